package com.expediagroup.adaptivealerting.detector.build.client;

import java.time.Duration;

@FunctionalInterface
interface Sleeper {
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
