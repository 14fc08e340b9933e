package io.intellixity.relata.expression;

public enum LogicalOperator { AND, OR, NOT }
