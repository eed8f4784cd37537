package com.github.germanosin.lifeevents.cdc;

public enum EngineState {
  IDLE,
  PROVISIONING,
  CONNECTING,
  STREAMING,
  RECOVERING,
  STOPPED
}
