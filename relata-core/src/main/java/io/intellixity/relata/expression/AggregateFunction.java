package io.intellixity.relata.expression;

public enum AggregateFunction { COUNT, SUM, AVG, MIN, MAX }
