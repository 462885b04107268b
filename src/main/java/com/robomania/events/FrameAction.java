package com.robomania.events;

import com.robomania.exceptions.RobomaniaException;
import com.robomania.stream.InboundFrame;

@FunctionalInterface
public interface FrameAction {
  void handle(InboundFrame frame) throws RobomaniaException;
}
