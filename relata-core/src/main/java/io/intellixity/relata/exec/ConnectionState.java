package io.intellixity.relata.exec;

public enum ConnectionState { DISCONNECTED, CONNECTED, IN_TRANSACTION }
