package com.onthegomap.tiledecoder.value;

import com.google.protobuf.ByteString;
import com.onthegomap.tiledecoder.DecodeException;
import com.onthegomap.tiledecoder.proto.ProtoReader;
import com.onthegomap.tiledecoder.proto.VectorTileFields.ValueMessage;

/**
 * Decodes {@code Tile.Value} messages from a layer's value dictionary.
 */
public final class ValueDecoder {

  private ValueDecoder() {}

  /**
   * Decodes one value message.
   * <p>
   * When a message sets more than one of the typed fields, the last one on the wire wins. A message without any
   * recognised field decodes to {@link Value#NULL}.
   *
   * @param view the encoded value message
   * @return the decoded value
   * @throws DecodeException if the message is malformed
   */
  public static Value decode(ByteString view) throws DecodeException {
    Value result = Value.NULL;
    ProtoReader reader = ProtoReader.of(view);
    while (reader.next()) {
      switch (reader.field()) {
        case ValueMessage.STRING -> result = Value.of(reader.readString());
        case ValueMessage.FLOAT -> result = Value.of((double) reader.readFloat());
        case ValueMessage.DOUBLE -> result = Value.of(reader.readDouble());
        case ValueMessage.INT -> result = Value.of(reader.readInt64());
        case ValueMessage.UINT -> result = Value.ofUnsigned(reader.readUInt64());
        case ValueMessage.SINT -> result = Value.of(reader.readSInt64());
        case ValueMessage.BOOL -> result = Value.of(reader.readBool());
        default -> reader.skip();
      }
    }
    return result;
  }
}
