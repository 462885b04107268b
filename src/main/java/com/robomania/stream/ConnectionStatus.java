package com.robomania.stream;

public enum ConnectionStatus {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  GIVING_UP
}
