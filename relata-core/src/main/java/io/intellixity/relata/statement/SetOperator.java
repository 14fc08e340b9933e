package io.intellixity.relata.statement;

public enum SetOperator { UNION, INTERSECT, EXCEPT }
