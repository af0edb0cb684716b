package com.codeheadsystems.warden.client.manager;

/**
 * Device registration progress.
 */
public enum RegistrationState {
  UNREGISTERED,
  ATTESTING,
  REGISTERING,
  REGISTERED,
  FAILED
}
