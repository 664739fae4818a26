/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.hdl.type;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Fixed-width bit-vector value.
 *
 * <p>A value has a width, {@link #nbits}, and an unsigned payload less than
 * 2<sup>nbits</sup>. Negative values are stored in two's complement.
 *
 * <p>Width rules follow Verilog. Addition and subtraction produce a value as
 * wide as the wider operand, wrapping around; multiplication produces a value
 * twice as wide; bitwise operators require non-negative operands and produce
 * a value as wide as the wider operand.
 *
 * <p>Values are immutable; operations return new values.
 */
public final class Bits {
  public final int nbits;
  private final BigInteger uint;

  private Bits(int nbits, BigInteger uint) {
    this.nbits = nbits;
    this.uint = uint;
  }

  /** Creates a value; throws if {@code value} does not fit. */
  public static Bits of(int nbits, long value) {
    return of(nbits, BigInteger.valueOf(value), false);
  }

  /** Creates a value. If {@code trunc}, excess high bits are discarded;
   * otherwise throws if the value does not fit in {@code nbits}. */
  public static Bits of(int nbits, BigInteger value, boolean trunc) {
    checkArgument(nbits > 0, "width must be positive: %s", nbits);
    if (!trunc) {
      final BigInteger max = BigInteger.ONE.shiftLeft(nbits)
          .subtract(BigInteger.ONE);
      final BigInteger min = BigInteger.ONE.shiftLeft(nbits).negate();
      checkArgument(value.compareTo(min) >= 0 && value.compareTo(max) <= 0,
          "value %s does not fit in %s bits", value, nbits);
    }
    return new Bits(nbits, value.and(mask(nbits)));
  }

  private static BigInteger mask(int nbits) {
    return BigInteger.ONE.shiftLeft(nbits).subtract(BigInteger.ONE);
  }

  /** Returns the unsigned value. */
  public BigInteger uint() {
    return uint;
  }

  /** Returns the value interpreted as a two's complement signed integer. */
  public BigInteger intValue() {
    return uint.testBit(nbits - 1)
        ? uint.subtract(BigInteger.ONE.shiftLeft(nbits))
        : uint;
  }

  /** Returns bit {@code i} as a 1-bit value. */
  public Bits get(int i) {
    checkArgument(i >= 0 && i < nbits, "index %s out of range for %s bits",
        i, nbits);
    return new Bits(1, uint.testBit(i) ? BigInteger.ONE : BigInteger.ZERO);
  }

  /** Returns bits {@code start} (inclusive) to {@code stop} (exclusive). */
  public Bits slice(int start, int stop) {
    checkArgument(0 <= start && start < stop && stop <= nbits,
        "invalid slice [%s:%s] of %s bits", start, stop, nbits);
    final int width = stop - start;
    return new Bits(width, uint.shiftRight(start).and(mask(width)));
  }

  /** Returns a copy of this value with bits {@code start} to {@code stop}
   * replaced. */
  public Bits withSlice(int start, int stop, Bits value) {
    checkArgument(0 <= start && start < stop && stop <= nbits,
        "invalid slice [%s:%s] of %s bits", start, stop, nbits);
    final int width = stop - start;
    checkArgument(value.nbits <= width,
        "value of %s bits is wider than slice of %s bits", value.nbits, width);
    final BigInteger cleared = uint.andNot(mask(width).shiftLeft(start));
    return new Bits(nbits, cleared.or(value.uint.shiftLeft(start)));
  }

  private Bits widen(long other) {
    return of(nbits, BigInteger.valueOf(other), false);
  }

  public Bits add(Bits other) {
    return of(Math.max(nbits, other.nbits), uint.add(other.uint), true);
  }

  public Bits add(long other) {
    return add(widen(other));
  }

  public Bits sub(Bits other) {
    return of(Math.max(nbits, other.nbits), uint.subtract(other.uint), true);
  }

  public Bits sub(long other) {
    return sub(widen(other));
  }

  /** Multiplies; the result is twice as wide as the operands, which must
   * have the same width. */
  public Bits mul(Bits other) {
    checkArgument(nbits == other.nbits,
        "operands have different widths: %s, %s", nbits, other.nbits);
    return of(2 * nbits, uint.multiply(other.uint), false);
  }

  public Bits mul(long other) {
    return of(2 * nbits, uint.multiply(BigInteger.valueOf(other)), true);
  }

  public Bits and(Bits other) {
    return new Bits(Math.max(nbits, other.nbits), uint.and(other.uint));
  }

  public Bits and(long other) {
    checkArgument(other >= 0, "operand must be non-negative: %s", other);
    return and(widen(other));
  }

  public Bits or(Bits other) {
    return new Bits(Math.max(nbits, other.nbits), uint.or(other.uint));
  }

  public Bits or(long other) {
    checkArgument(other >= 0, "operand must be non-negative: %s", other);
    return or(widen(other));
  }

  public Bits xor(Bits other) {
    return new Bits(Math.max(nbits, other.nbits), uint.xor(other.uint));
  }

  public Bits xor(long other) {
    checkArgument(other >= 0, "operand must be non-negative: %s", other);
    return xor(widen(other));
  }

  public Bits invert() {
    return of(nbits, uint.not(), true);
  }

  /** Shifts left, keeping the width; shifting by the width or more gives
   * zero. */
  public Bits shiftLeft(int n) {
    if (n >= nbits) {
      return new Bits(nbits, BigInteger.ZERO);
    }
    return of(nbits, uint.shiftLeft(n), true);
  }

  public Bits shiftRight(int n) {
    return new Bits(nbits, uint.shiftRight(n));
  }

  /** Zero-extends to a wider value. */
  public Bits zext(int newWidth) {
    checkArgument(newWidth >= nbits, "cannot extend %s bits to %s", nbits,
        newWidth);
    return new Bits(newWidth, uint);
  }

  /** Sign-extends to a wider value. */
  public Bits sext(int newWidth) {
    checkArgument(newWidth >= nbits, "cannot extend %s bits to %s", nbits,
        newWidth);
    return of(newWidth, intValue(), true);
  }

  /** Concatenates values; the first argument supplies the most significant
   * bits. */
  public static Bits concat(Bits... args) {
    checkArgument(args.length > 0, "nothing to concatenate");
    int width = 0;
    BigInteger v = BigInteger.ZERO;
    for (Bits arg : args) {
      v = v.shiftLeft(arg.nbits).or(arg.uint);
      width += arg.nbits;
    }
    return new Bits(width, v);
  }

  /** Returns 1 if all bits are set. */
  public Bits reduceAnd() {
    return bit(uint.equals(mask(nbits)));
  }

  /** Returns 1 if any bit is set. */
  public Bits reduceOr() {
    return bit(uint.signum() != 0);
  }

  /** Returns 1 if an odd number of bits are set. */
  public Bits reduceXor() {
    return bit(uint.bitCount() % 2 == 1);
  }

  private static Bits bit(boolean b) {
    return new Bits(1, b ? BigInteger.ONE : BigInteger.ZERO);
  }

  /** Returns the value as a binary string, padded to the width. */
  public String binString() {
    return Strings.padStart(uint.toString(2), nbits, '0');
  }

  @Override
  public int hashCode() {
    return Objects.hash(nbits, uint);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Bits
            && nbits == ((Bits) o).nbits
            && uint.equals(((Bits) o).uint);
  }

  /** Returns the value in hexadecimal, padded to the width. */
  @Override
  public String toString() {
    final int chars = (nbits - 1) / 4 + 1;
    return Strings.padStart(uint.toString(16), chars, '0');
  }
}

// End Bits.java
