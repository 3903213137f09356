package com.onthegomap.tiledecoder.proto;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import com.onthegomap.tiledecoder.DecodeException;
import java.io.IOException;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Cursor over the fields of one protobuf message held in a {@link ByteString} view.
 * <p>
 * Length-delimited reads return slices of the backing bytes instead of copies, so a reader over a view of an
 * {@link com.google.protobuf.UnsafeByteOperations#unsafeWrap(byte[]) unsafe-wrapped} array never duplicates payload
 * bytes. Every failure reported by protobuf is rethrown as a {@link DecodeException} of kind
 * {@link DecodeException.Kind#PRIMITIVE_READ_ERROR}.
 * <p>
 * Usage:
 *
 * <pre>{@code
 * var reader = ProtoReader.of(view);
 * while (reader.next()) {
 *   switch (reader.field()) {
 *     case 1 -> name = reader.readString();
 *     default -> reader.skip();
 *   }
 * }
 * }</pre>
 */
@NotThreadSafe
public final class ProtoReader {

  private final CodedInputStream input;
  private int tag = 0;

  private ProtoReader(ByteString view) {
    this.input = view.newCodedInput();
    this.input.enableAliasing(true);
  }

  public static ProtoReader of(ByteString view) {
    return new ProtoReader(view);
  }

  /** Advances to the next field and returns {@code false} once the end of the view is reached. */
  public boolean next() throws DecodeException {
    try {
      tag = input.readTag();
    } catch (IOException e) {
      throw readError("field tag", e);
    }
    return tag != 0;
  }

  /** Returns the field number of the current field. */
  public int field() {
    return WireFormat.getTagFieldNumber(tag);
  }

  /** Returns the wire type of the current field. */
  public int wireType() {
    return WireFormat.getTagWireType(tag);
  }

  /** Skips the value of the current field. */
  public void skip() throws DecodeException {
    try {
      input.skipField(tag);
    } catch (IOException e) {
      throw readError("skipped field", e);
    }
  }

  public int readUInt32() throws DecodeException {
    expect(WireFormat.WIRETYPE_VARINT);
    try {
      return input.readUInt32();
    } catch (IOException e) {
      throw readError("uint32", e);
    }
  }

  public long readUInt64() throws DecodeException {
    expect(WireFormat.WIRETYPE_VARINT);
    try {
      return input.readUInt64();
    } catch (IOException e) {
      throw readError("uint64", e);
    }
  }

  public long readInt64() throws DecodeException {
    expect(WireFormat.WIRETYPE_VARINT);
    try {
      return input.readInt64();
    } catch (IOException e) {
      throw readError("int64", e);
    }
  }

  public long readSInt64() throws DecodeException {
    expect(WireFormat.WIRETYPE_VARINT);
    try {
      return input.readSInt64();
    } catch (IOException e) {
      throw readError("sint64", e);
    }
  }

  public int readEnum() throws DecodeException {
    expect(WireFormat.WIRETYPE_VARINT);
    try {
      return input.readEnum();
    } catch (IOException e) {
      throw readError("enum", e);
    }
  }

  public boolean readBool() throws DecodeException {
    expect(WireFormat.WIRETYPE_VARINT);
    try {
      return input.readBool();
    } catch (IOException e) {
      throw readError("bool", e);
    }
  }

  public float readFloat() throws DecodeException {
    expect(WireFormat.WIRETYPE_FIXED32);
    try {
      return input.readFloat();
    } catch (IOException e) {
      throw readError("float", e);
    }
  }

  public double readDouble() throws DecodeException {
    expect(WireFormat.WIRETYPE_FIXED64);
    try {
      return input.readDouble();
    } catch (IOException e) {
      throw readError("double", e);
    }
  }

  /** Reads a UTF-8 string field, replacing invalid sequences the way protobuf's non-strict string reader does. */
  public String readString() throws DecodeException {
    expect(WireFormat.WIRETYPE_LENGTH_DELIMITED);
    try {
      return input.readString();
    } catch (IOException e) {
      throw readError("string", e);
    }
  }

  /** Returns a view over the current length-delimited field without copying it. */
  public ByteString readView() throws DecodeException {
    expect(WireFormat.WIRETYPE_LENGTH_DELIMITED);
    try {
      return input.readBytes();
    } catch (IOException e) {
      throw readError("length-delimited field", e);
    }
  }

  /** Returns the current packed {@code uint32} field as a lazily-decoded sequence. */
  public PackedUint32 readPackedUInt32() throws DecodeException {
    return new PackedUint32(readView());
  }

  private void expect(int wireType) throws DecodeException {
    if (wireType() != wireType) {
      throw new DecodeException(DecodeException.Kind.PRIMITIVE_READ_ERROR,
        "field %d has wire type %d, expected %d".formatted(field(), wireType(), wireType));
    }
  }

  private DecodeException readError(String what, IOException e) {
    return new DecodeException(DecodeException.Kind.PRIMITIVE_READ_ERROR,
      "unable to read " + what + " of field " + field() + ": " + e.getMessage(), e);
  }
}
