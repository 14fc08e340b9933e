package io.intellixity.relata.error;

import io.intellixity.relata.sql.Capability;

/** The active dialect cannot express the requested construct. Permanent; never retry. */
public final class UnsupportedCapabilityException extends RelataException {
  private final Capability capability;

  public UnsupportedCapabilityException(String dialectId, Capability capability, String clause) {
    super(ErrorKind.CAPABILITY, dialectId, clause, capability + " is not supported on this backend");
    this.capability = capability;
  }

  public Capability capability() { return capability; }
}
