package com.onthegomap.tiledecoder.proto;

import com.carrotsearch.hppc.IntArrayList;
import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.onthegomap.tiledecoder.DecodeException;
import java.io.IOException;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A packed repeated {@code uint32} field kept as an undecoded view, decoded one varint at a time through a
 * {@link Cursor}.
 */
@Immutable
public final class PackedUint32 {

  public static final PackedUint32 EMPTY = new PackedUint32(ByteString.EMPTY);

  private final ByteString view;

  PackedUint32(ByteString view) {
    this.view = view;
  }

  /** Wraps an already-encoded packed varint payload. */
  public static PackedUint32 of(ByteString view) {
    return view.isEmpty() ? EMPTY : new PackedUint32(view);
  }

  public boolean isEmpty() {
    return view.isEmpty();
  }

  /** Returns the size in bytes of the encoded payload. */
  public int byteSize() {
    return view.size();
  }

  /**
   * Returns the number of varints in the payload by counting terminating bytes, without decoding them.
   * <p>
   * A truncated trailing varint is not counted; it is reported when a {@link Cursor} reaches it.
   */
  public int count() {
    int count = 0;
    var iterator = view.iterator();
    while (iterator.hasNext()) {
      if ((iterator.nextByte() & 0x80) == 0) {
        count++;
      }
    }
    return count;
  }

  /** Returns a new cursor positioned at the first value. */
  public Cursor cursor() {
    return new Cursor(view.newCodedInput());
  }

  /** Decodes every value into a new list. */
  public IntArrayList toList() throws DecodeException {
    IntArrayList result = new IntArrayList(count());
    var cursor = cursor();
    while (cursor.hasNext()) {
      result.add(cursor.next());
    }
    return result;
  }

  /** Forward-only iterator over the values of a {@link PackedUint32}. */
  @NotThreadSafe
  public static final class Cursor {

    private final CodedInputStream input;

    private Cursor(CodedInputStream input) {
      this.input = input;
    }

    public boolean hasNext() throws DecodeException {
      try {
        return !input.isAtEnd();
      } catch (IOException e) {
        throw new DecodeException(DecodeException.Kind.PRIMITIVE_READ_ERROR, "unable to read packed field", e);
      }
    }

    /** Returns the next value as the raw 32 bits of the unsigned varint. */
    public int next() throws DecodeException {
      try {
        return input.readRawVarint32();
      } catch (IOException e) {
        throw new DecodeException(DecodeException.Kind.PRIMITIVE_READ_ERROR,
          "malformed varint in packed field: " + e.getMessage(), e);
      }
    }
  }
}
