package com.ospicorp.energyapi.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class MinMaxScalerTest {

  @Test
  void scalesIntoUnitInterval() {
    var scaler = MinMaxScaler.fit(new double[] {10d, 20d, 30d});

    assertArrayEquals(new double[] {0d, 0.5d, 1d}, scaler.scale(new double[] {10d, 20d, 30d}),
        1e-12);
    assertEquals(25d, scaler.inverse(0.75d), 1e-12);
  }

  @Test
  void constantWindowScalesToZeroAndInvertsToConstant() {
    var scaler = MinMaxScaler.fit(new double[] {7d, 7d, 7d});

    assertEquals(0d, scaler.scale(7d));
    assertEquals(7d, scaler.inverse(0d));
    assertEquals(7d, scaler.inverse(1d));
  }
}
