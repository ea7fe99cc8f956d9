package com.ospicorp.energyapi.consumption.service;

import com.ospicorp.energyapi.consumption.model.DataPoint;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Filler {
  private Filler() {
  }

  /**
   * Carries the last defined value forward into undefined points. Points before the first
   * defined value stay undefined; nothing is fabricated.
   */
  public static List<DataPoint> forwardFill(List<DataPoint> in) {
    List<DataPoint> out = new ArrayList<>(in.size());
    Double last = null;
    for (var p : in) {
      last = (p.value() != null) ? p.value() : last;
      out.add(new DataPoint(p.timestamp(), last));
    }
    return Collections.unmodifiableList(out);
  }
}
