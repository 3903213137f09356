package com.onthegomap.tiledecoder.geo;

/**
 * Geometry command ids packed into the low 3 bits of a command integer.
 *
 * @see <a href="https://github.com/mapbox/vector-tile-spec/tree/master/2.1#433-command-types">Command Types</a>
 */
enum Command {
  MOVE_TO(1),
  LINE_TO(2),
  CLOSE_PATH(7);

  final int value;

  Command(int value) {
    this.value = value;
  }

  static int id(int commandInteger) {
    return commandInteger & 0x7;
  }

  static long count(int commandInteger) {
    return Integer.toUnsignedLong(commandInteger) >>> 3;
  }
}
