package com.example.bondspread.core.services;

import com.example.bondspread.common.utils.NumberUtil;
import com.example.bondspread.trading.model.SignalClassification;
import com.example.bondspread.trading.model.SignalDirection;
import com.example.bondspread.trading.model.SignalType;
import org.springframework.stereotype.Service;

/**
 * Классификация текущего спреда относительно перцентилей окна.
 * Проверки идут по порядку, срабатывает первая подходящая.
 */
@Service
public class SignalClassifier {

    public static final double STRONG_MIN_CONFIDENCE = 0.7;
    public static final double BAND_BASE_CONFIDENCE = 0.4;
    public static final double BAND_CONFIDENCE_RANGE = 0.3;
    public static final double NEUTRAL_CONFIDENCE = 0.2;

    public SignalClassification classify(double current, double p10, double p25, double p75, double p90, double zscore) {
        // Спред ниже P10 - слишком узкий, ждём расширения
        if (current <= p10) {
            return SignalClassification.of(SignalType.STRONG_BUY, SignalDirection.LONG_SHORT, strongConfidence(zscore));
        }

        if (current <= p25) {
            return SignalClassification.of(SignalType.BUY, SignalDirection.LONG_SHORT,
                    bandConfidence(p25 - current, p25 - p10));
        }

        // Любой спред >= P90 уже попадает сюда, поэтому STRONG_SELL ниже не достигается
        if (current >= p75) {
            return SignalClassification.of(SignalType.SELL, SignalDirection.SHORT_LONG,
                    bandConfidence(current - p75, p90 - p75));
        }

        if (current >= p90) {
            return SignalClassification.of(SignalType.STRONG_SELL, SignalDirection.SHORT_LONG, strongConfidence(zscore));
        }

        return SignalClassification.of(SignalType.NEUTRAL, SignalDirection.FLAT, NEUTRAL_CONFIDENCE);
    }

    /**
     * Ожидаемый возврат к среднему в б.п. с учётом направления
     */
    public double expectedReturn(double current, double mean, SignalDirection direction) {
        if (direction == SignalDirection.FLAT) {
            return 0.0;
        }
        double expectedMove = mean - current;
        return direction == SignalDirection.LONG_SHORT
                ? NumberUtil.round(expectedMove, 2)
                : NumberUtil.round(-expectedMove, 2);
    }

    private double strongConfidence(double zscore) {
        return Math.max(STRONG_MIN_CONFIDENCE, Math.min(1.0, Math.abs(zscore) / 3));
    }

    private double bandConfidence(double distance, double bandWidth) {
        if (!(bandWidth > 0)) {
            return BAND_BASE_CONFIDENCE;
        }
        // за пределами полосы (спред выше P90 на ветке SELL) уверенность ограничена единицей
        return Math.min(1.0, BAND_BASE_CONFIDENCE + BAND_CONFIDENCE_RANGE * distance / bandWidth);
    }
}
