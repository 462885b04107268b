package com.robomania.stream;

@FunctionalInterface
public interface FrameHandler {
  void onFrame(InboundFrame frame);
}
