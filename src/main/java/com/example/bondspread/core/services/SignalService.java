package com.example.bondspread.core.services;

import com.example.bondspread.common.exceptions.EmptySpreadSeriesException;
import com.example.bondspread.common.model.BondPair;
import com.example.bondspread.common.model.SpreadStats;
import com.example.bondspread.common.utils.NumberUtil;
import com.example.bondspread.config.SignalSettings;
import com.example.bondspread.trading.model.SignalClassification;
import com.example.bondspread.trading.model.SignalDirection;
import com.example.bondspread.trading.model.SignalType;
import com.example.bondspread.trading.model.TradingSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Генерация торговых сигналов по истории спредов пары
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalService {
    private final SpreadService spreadService;
    private final SignalClassifier signalClassifier;
    private final SignalSettings signalSettings;
    private final Clock clock;

    public TradingSignal generateSignal(List<Double> spreadSeries, String bondLong, String bondShort) {
        return generateSignal(spreadSeries, bondLong, bondShort, null);
    }

    public TradingSignal generateSignal(List<Double> spreadSeries, String bondLong, String bondShort, String pairName) {
        String name = pairName != null ? pairName : BondPair.of(bondLong, bondShort).getPairName();
        LocalDateTime now = LocalDateTime.now(clock);

        List<Double> clean = spreadSeries.stream()
                .filter(v -> !NumberUtil.isMissing(v))
                .toList();
        if (clean.size() < signalSettings.getMinObservations()) {
            log.debug("Пара {}: {} наблюдений, нужно минимум {}", name, clean.size(), signalSettings.getMinObservations());
            return noDataSignal(bondLong, bondShort, name, now);
        }

        SpreadStats stats;
        try {
            stats = spreadService.calculateSpreadStats(clean, signalSettings.getPercentileWindow());
        } catch (EmptySpreadSeriesException e) {
            log.debug("Пара {}: {}", name, e.getMessage());
            return noDataSignal(bondLong, bondShort, name, now);
        }

        int window = signalSettings.getPercentileWindow();
        double p10 = spreadService.calculatePercentile(clean, window, signalSettings.getEntryThresholdLow());
        double p25 = spreadService.calculatePercentile(clean, window, signalSettings.getEntryThresholdMid());
        double p75 = spreadService.calculatePercentile(clean, window, signalSettings.getExitThresholdMid());
        double p90 = spreadService.calculatePercentile(clean, window, signalSettings.getExitThresholdHigh());

        // ранг считается по всей истории, а не по окну перцентилей
        double percentileRank = spreadService.getSpreadPercentileRank(stats.getCurrent(), clean);

        SignalClassification classification = signalClassifier.classify(
                stats.getCurrent(), p10, p25, p75, p90, stats.getZscore());
        double expectedReturn = signalClassifier.expectedReturn(
                stats.getCurrent(), stats.getMean(), classification.getDirection());

        TradingSignal signal = TradingSignal.builder()
                .pairName(name)
                .bondLong(bondLong)
                .bondShort(bondShort)
                .signalType(classification.getSignalType())
                .direction(classification.getDirection())
                .confidence(NumberUtil.round(classification.getConfidence(), 3))
                .spreadBp(stats.getCurrent())
                .spreadMean(stats.getMean())
                .spreadZscore(stats.getZscore())
                .percentileRank(percentileRank)
                .expectedReturnBp(expectedReturn)
                .timestamp(now)
                .expiresAt(now.plusHours(signalSettings.getSignalExpiryHours()))
                .build();

        log.debug("Сигнал {}: {} {} (уверенность {}, спред {} б.п., ранг {})", name, signal.getSignalType(),
                signal.getDirection(), signal.getConfidence(), signal.getSpreadBp(), signal.getPercentileRank());
        return signal;
    }

    /**
     * Сигналы по всем парам, для которых есть история спредов. Пары без истории пропускаются.
     */
    public List<TradingSignal> generateAllSignals(Map<String, List<Double>> historyByPair, List<BondPair> pairs) {
        List<TradingSignal> signals = new ArrayList<>();
        for (BondPair pair : pairs) {
            String pairName = pair.getPairName();
            List<Double> history = historyByPair.get(pairName);
            if (history == null) {
                log.warn("⚠️ Нет истории для пары {}", pairName);
                continue;
            }
            signals.add(generateSignal(history, pair.getBondLong(), pair.getBondShort(), pairName));
        }
        log.info("📊 Сгенерировано {} сигналов для {} пар", signals.size(), pairs.size());
        return signals;
    }

    public List<TradingSignal> filterSignals(List<TradingSignal> signals) {
        return filterSignals(signals, null, true);
    }

    /**
     * Отбрасывает NO_DATA, сигналы с уверенностью ниже порога и, при excludeNeutral, NEUTRAL
     *
     * @param minConfidence порог уверенности; null - из настроек
     */
    public List<TradingSignal> filterSignals(List<TradingSignal> signals, Double minConfidence, boolean excludeNeutral) {
        double threshold = minConfidence != null ? minConfidence : signalSettings.getMinConfidence();
        return signals.stream()
                .filter(s -> s.getSignalType() != SignalType.NO_DATA)
                .filter(s -> !excludeNeutral || s.getSignalType() != SignalType.NEUTRAL)
                .filter(s -> s.getConfidence() >= threshold)
                .toList();
    }

    /**
     * Сигналы, срок которых ещё не истёк
     */
    public List<TradingSignal> getActiveSignals(List<TradingSignal> signals) {
        LocalDateTime now = LocalDateTime.now(clock);
        return signals.stream()
                .filter(s -> !s.isExpired(now))
                .toList();
    }

    private TradingSignal noDataSignal(String bondLong, String bondShort, String pairName, LocalDateTime now) {
        return TradingSignal.builder()
                .pairName(pairName)
                .bondLong(bondLong)
                .bondShort(bondShort)
                .signalType(SignalType.NO_DATA)
                .direction(SignalDirection.FLAT)
                .confidence(0.0)
                .percentileRank(50.0)
                .timestamp(now)
                .build();
    }
}
