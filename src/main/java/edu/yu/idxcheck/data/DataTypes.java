package edu.yu.idxcheck.data;

/**
 * The data types available to fixtures.
 */
public final class DataTypes {

    public static final DataType<Long> LONG = new LongType();
    public static final DataType<Integer> INT = new IntType();
    public static final DataType<byte[]> VAR_BYTES = new VarBytesType();

    private DataTypes() {
    }
}
