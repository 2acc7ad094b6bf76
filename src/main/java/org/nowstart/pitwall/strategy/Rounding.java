package org.nowstart.pitwall.strategy;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Rounding {

    private Rounding() {
    }

    static double round3(double value) {
        return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }
}
