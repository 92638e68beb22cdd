package com.earnix.parquet.inspector.value;

public interface ValueVisitor<T>
{
	T visitNull(Value.Null value);

	T visitScalar(Value.Scalar value);

	T visitList(Value.ListValue value);

	T visitMap(Value.MapValue value);

	T visitGroup(Value.GroupValue value);
}
