/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.dirc.common.lang;

import java.util.concurrent.atomic.AtomicInteger;

import exm.dirc.common.exceptions.DIRCRuntimeError;

/**
 * Machine-level types attached to constants, typed expressions,
 * parameters and returns, and used as values in type constraints.
 *
 * All types are immutable; "changing" a size returns a new type.
 */
public class Types {

  /** Size in bits of the machine word */
  public static final int STD_SIZE = 32;

  public static enum StructureType {
    VOID,
    BOOLEAN,
    CHAR,
    INTEGER,
    FLOAT,
    POINTER,
    ARRAY,
    SIZE,
    NAMED,
  }

  public abstract static class Type implements Comparable<Type> {

    public abstract StructureType structureType();

    /** C rendering of the type, e.g. "unsigned int" or "char *" */
    public abstract String getCtype();

    /** Size in bits, or 0 if unknown */
    public abstract int getSize();

    /**
     * @param size new size in bits
     * @return type of same kind with the given size.  Types without
     *    a variable size return themselves
     */
    public Type withSize(int size) {
      return this;
    }

    public boolean isVoid() {
      return structureType() == StructureType.VOID;
    }

    public boolean isBoolean() {
      return structureType() == StructureType.BOOLEAN;
    }

    public boolean isChar() {
      return structureType() == StructureType.CHAR;
    }

    public boolean isInteger() {
      return structureType() == StructureType.INTEGER;
    }

    public boolean isFloat() {
      return structureType() == StructureType.FLOAT;
    }

    public boolean isPointer() {
      return structureType() == StructureType.POINTER;
    }

    public boolean isArray() {
      return structureType() == StructureType.ARRAY;
    }

    public boolean isSize() {
      return structureType() == StructureType.SIZE;
    }

    public boolean isPointerToAlpha() {
      return false;
    }

    /**
     * Compare broad types, ignoring sizes and signedness
     */
    public boolean sameBroadType(Type other) {
      return structureType() == other.structureType();
    }

    /**
     * Compare fields of a type with the same structure type
     */
    protected abstract int compareSameKind(Type other);

    @Override
    public int compareTo(Type o) {
      int kindComp = structureType().compareTo(o.structureType());
      if (kindComp != 0) {
        return kindComp;
      }
      return compareSameKind(o);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Type)) {
        return false;
      }
      return compareTo((Type)obj) == 0;
    }

    @Override
    public abstract int hashCode();

    @Override
    public String toString() {
      return getCtype();
    }
  }

  public static class VoidType extends Type {
    private VoidType() {
    }

    @Override
    public StructureType structureType() {
      return StructureType.VOID;
    }

    @Override
    public String getCtype() {
      return "void";
    }

    @Override
    public int getSize() {
      return 0;
    }

    @Override
    protected int compareSameKind(Type other) {
      return 0;
    }

    @Override
    public int hashCode() {
      return VoidType.class.hashCode();
    }
  }

  public static class BooleanType extends Type {
    private BooleanType() {
    }

    @Override
    public StructureType structureType() {
      return StructureType.BOOLEAN;
    }

    @Override
    public String getCtype() {
      return "bool";
    }

    @Override
    public int getSize() {
      return 1;
    }

    @Override
    protected int compareSameKind(Type other) {
      return 0;
    }

    @Override
    public int hashCode() {
      return BooleanType.class.hashCode();
    }
  }

  public static class CharType extends Type {
    private CharType() {
    }

    @Override
    public StructureType structureType() {
      return StructureType.CHAR;
    }

    @Override
    public String getCtype() {
      return "char";
    }

    @Override
    public int getSize() {
      return 8;
    }

    @Override
    protected int compareSameKind(Type other) {
      return 0;
    }

    @Override
    public int hashCode() {
      return CharType.class.hashCode();
    }
  }

  public static class IntegerType extends Type {
    private final int size;
    /** positive: signed, negative: unsigned, zero: unknown */
    private final int signedness;

    private IntegerType(int size, int signedness) {
      this.size = size;
      this.signedness = signedness;
    }

    public int getSignedness() {
      return signedness;
    }

    public boolean isSigned() {
      return signedness >= 0;
    }

    public boolean isUnsigned() {
      return signedness < 0;
    }

    @Override
    public StructureType structureType() {
      return StructureType.INTEGER;
    }

    @Override
    public String getCtype() {
      String prefix = signedness < 0 ? "unsigned " : "";
      switch (size) {
        case 0:
        case 32:
          return prefix + "int";
        case 16:
          return prefix + "short";
        case 8:
          return prefix + "char";
        case 1:
          return "bool";
        case 64:
          return prefix + "long long";
        default:
          return prefix + "__size" + size;
      }
    }

    @Override
    public int getSize() {
      return size;
    }

    @Override
    public Type withSize(int newSize) {
      return new IntegerType(newSize, signedness);
    }

    @Override
    protected int compareSameKind(Type other) {
      IntegerType o = (IntegerType)other;
      if (size != o.size) {
        return size < o.size ? -1 : 1;
      }
      return Integer.compare(Integer.signum(signedness),
                             Integer.signum(o.signedness));
    }

    @Override
    public int hashCode() {
      return IntegerType.class.hashCode() ^ (size * 3 + Integer.signum(signedness));
    }
  }

  public static class FloatType extends Type {
    private final int size;

    private FloatType(int size) {
      this.size = size;
    }

    @Override
    public StructureType structureType() {
      return StructureType.FLOAT;
    }

    @Override
    public String getCtype() {
      switch (size) {
        case 32:
          return "float";
        case 80:
          return "long double";
        default:
          return "double";
      }
    }

    @Override
    public int getSize() {
      return size;
    }

    @Override
    public Type withSize(int newSize) {
      return new FloatType(newSize);
    }

    @Override
    protected int compareSameKind(Type other) {
      return Integer.compare(size, ((FloatType)other).size);
    }

    @Override
    public int hashCode() {
      return FloatType.class.hashCode() ^ size;
    }
  }

  public static class PointerType extends Type {
    private final Type pointsTo;

    private PointerType(Type pointsTo) {
      assert(pointsTo != null);
      this.pointsTo = pointsTo;
    }

    public Type getPointsTo() {
      return pointsTo;
    }

    @Override
    public boolean isPointerToAlpha() {
      return pointsTo instanceof NamedType &&
             ((NamedType)pointsTo).isAlpha();
    }

    @Override
    public StructureType structureType() {
      return StructureType.POINTER;
    }

    @Override
    public String getCtype() {
      return pointsTo.getCtype() + " *";
    }

    @Override
    public int getSize() {
      return STD_SIZE;
    }

    @Override
    protected int compareSameKind(Type other) {
      return pointsTo.compareTo(((PointerType)other).pointsTo);
    }

    @Override
    public int hashCode() {
      return PointerType.class.hashCode() ^ (31 * pointsTo.hashCode());
    }
  }

  public static class ArrayType extends Type {
    private final Type baseType;
    /** Number of elements, or -1 if unbounded */
    private final long length;

    private ArrayType(Type baseType, long length) {
      assert(baseType != null);
      this.baseType = baseType;
      this.length = length;
    }

    public Type getBaseType() {
      return baseType;
    }

    public long getLength() {
      return length;
    }

    public boolean isUnbounded() {
      return length < 0;
    }

    @Override
    public StructureType structureType() {
      return StructureType.ARRAY;
    }

    @Override
    public String getCtype() {
      if (isUnbounded()) {
        return baseType.getCtype() + "[]";
      }
      return baseType.getCtype() + "[" + length + "]";
    }

    @Override
    public int getSize() {
      if (isUnbounded()) {
        return 0;
      }
      return (int)(baseType.getSize() * length);
    }

    @Override
    protected int compareSameKind(Type other) {
      ArrayType o = (ArrayType)other;
      int baseComp = baseType.compareTo(o.baseType);
      if (baseComp != 0) {
        return baseComp;
      }
      return Long.compare(length, o.length);
    }

    @Override
    public int hashCode() {
      return ArrayType.class.hashCode() ^ (31 * baseType.hashCode())
                                         ^ (int)length;
    }
  }

  /**
   * A type of which only the size is known
   */
  public static class SizeType extends Type {
    private final int size;

    private SizeType(int size) {
      this.size = size;
    }

    @Override
    public StructureType structureType() {
      return StructureType.SIZE;
    }

    @Override
    public String getCtype() {
      return "__size" + size;
    }

    @Override
    public int getSize() {
      return size;
    }

    @Override
    public Type withSize(int newSize) {
      return new SizeType(newSize);
    }

    @Override
    protected int compareSameKind(Type other) {
      return Integer.compare(size, ((SizeType)other).size);
    }

    @Override
    public int hashCode() {
      return SizeType.class.hashCode() ^ size;
    }
  }

  /**
   * A type referred to by name only.  Names starting with
   * {@link #ALPHA_PREFIX} are type variables created for
   * constraints.
   */
  public static class NamedType extends Type {
    public static final String ALPHA_PREFIX = "alpha";

    private final String name;

    private NamedType(String name) {
      assert(name != null);
      this.name = name;
    }

    public String getName() {
      return name;
    }

    public boolean isAlpha() {
      return name.startsWith(ALPHA_PREFIX);
    }

    @Override
    public StructureType structureType() {
      return StructureType.NAMED;
    }

    @Override
    public String getCtype() {
      return name;
    }

    @Override
    public int getSize() {
      return 0;
    }

    @Override
    protected int compareSameKind(Type other) {
      return name.compareTo(((NamedType)other).name);
    }

    @Override
    public int hashCode() {
      return NamedType.class.hashCode() ^ name.hashCode();
    }
  }

  public static final Type VOID = new VoidType();
  public static final Type BOOL = new BooleanType();
  public static final Type CHAR = new CharType();
  /** Integer of unknown size and signedness */
  public static final Type INT_ANY = new IntegerType(0, 0);
  public static final Type INT32 = new IntegerType(STD_SIZE, 0);

  private static final AtomicInteger nextAlpha = new AtomicInteger(0);

  public static Type intType(int size) {
    return new IntegerType(size, 0);
  }

  public static Type intType(int size, int signedness) {
    return new IntegerType(size, signedness);
  }

  public static Type floatType(int size) {
    return new FloatType(size);
  }

  public static Type pointerTo(Type pointsTo) {
    return new PointerType(pointsTo);
  }

  public static Type arrayOf(Type base, long length) {
    return new ArrayType(base, length);
  }

  public static Type sizeType(int size) {
    if (size <= 0) {
      throw new DIRCRuntimeError("Invalid size for size type: " + size);
    }
    return new SizeType(size);
  }

  public static Type named(String name) {
    return new NamedType(name);
  }

  /**
   * @return a pointer to a fresh type variable
   */
  public static Type pointerToAlpha() {
    return new PointerType(new NamedType(NamedType.ALPHA_PREFIX +
                                         nextAlpha.incrementAndGet()));
  }
}
