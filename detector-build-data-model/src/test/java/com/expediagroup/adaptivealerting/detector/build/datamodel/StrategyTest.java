package com.expediagroup.adaptivealerting.detector.build.datamodel;

import com.expediagroup.adaptivealerting.detector.build.datamodel.exception.UnknownStrategyException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class StrategyTest {

  @Test
  void testFromName() {
    Assertions.assertEquals(Strategy.SIGMA, Strategy.fromName("sigma"));
    Assertions.assertEquals(Strategy.QUARTILE, Strategy.fromName(" QUARTILE "));
    Assertions.assertThrows(UnknownStrategyException.class, () -> Strategy.fromName("median"));
    Assertions.assertThrows(UnknownStrategyException.class, () -> Strategy.fromName(null));
  }
}
