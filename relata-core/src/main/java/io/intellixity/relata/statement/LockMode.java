package io.intellixity.relata.statement;

public enum LockMode { NONE, FOR_UPDATE, FOR_SHARE }
