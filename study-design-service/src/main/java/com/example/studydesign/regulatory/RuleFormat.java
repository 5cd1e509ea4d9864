package com.example.studydesign.regulatory;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class RuleFormat {

    private RuleFormat() {
    }

    static String number(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }
}
