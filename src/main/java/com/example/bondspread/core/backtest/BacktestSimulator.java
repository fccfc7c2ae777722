package com.example.bondspread.core.backtest;

import com.example.bondspread.calculators.RollingStatisticsCalculator;
import com.example.bondspread.common.model.SpreadObservation;
import com.example.bondspread.config.BacktestSettings;
import com.example.bondspread.trading.model.EquityPoint;
import com.example.bondspread.trading.model.ExitReasonType;
import com.example.bondspread.trading.model.Position;
import com.example.bondspread.trading.model.SignalDirection;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Прогон одной пары по истории спредов. Держит капитал, открытую позицию и кривую капитала,
 * поэтому на каждый прогон создаётся новый экземпляр.
 * <p>
 * Без позиции: вход LONG_SHORT при спреде <= P10, SHORT_LONG при спреде >= P90.
 * С позицией: стоп, тейк, возврат к P50, максимальное время удержания - в этом порядке.
 */
@Slf4j
public class BacktestSimulator {

    private static final double P10 = 10.0;
    private static final double P50 = 50.0;
    private static final double P90 = 90.0;

    private final BacktestSettings settings;
    private final String pairName;

    @Getter
    private double capital;
    private Position openPosition;
    private final List<Position> closedPositions = new ArrayList<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();
    private boolean finished;

    public BacktestSimulator(BacktestSettings settings, String pairName) {
        this.settings = settings;
        this.pairName = pairName;
        this.capital = settings.getInitialCapital();
    }

    /**
     * Прогоняет упорядоченную по времени историю. Позиция, открытая на конце истории, в результат не попадает.
     *
     * @return закрытые позиции в порядке закрытия
     */
    public List<Position> run(List<SpreadObservation> observations) {
        if (finished) {
            throw new IllegalStateException("Симулятор пары " + pairName + " уже отработал");
        }
        finished = true;

        double[] spreads = observations.stream().mapToDouble(SpreadObservation::getSpreadBp).toArray();
        int window = settings.getPercentileWindow();
        int minPeriods = settings.getMinPercentilePeriods();
        double[] p10 = RollingStatisticsCalculator.percentile(spreads, window, minPeriods, P10);
        double[] p50 = RollingStatisticsCalculator.percentile(spreads, window, minPeriods, P50);
        double[] p90 = RollingStatisticsCalculator.percentile(spreads, window, minPeriods, P90);

        int skipped = 0;
        for (int i = 0; i < observations.size(); i++) {
            if (Double.isNaN(p10[i]) || Double.isNaN(p90[i])) {
                skipped++;
                continue;
            }
            SpreadObservation observation = observations.get(i);

            if (openPosition != null) {
                managePosition(observation, p50[i]);
            }
            if (openPosition == null) {
                tryOpen(observation, p10[i], p90[i]);
            }
        }

        if (skipped > 0) {
            log.debug("Пара {}: пропущено {} шагов без перцентилей", pairName, skipped);
        }
        if (openPosition != null) {
            log.debug("Пара {}: позиция от {} не закрыта к концу истории", pairName, openPosition.getEntryDate());
        }
        return getClosedPositions();
    }

    public List<Position> getClosedPositions() {
        return Collections.unmodifiableList(closedPositions);
    }

    public List<EquityPoint> getEquityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }

    private void managePosition(SpreadObservation observation, double median) {
        double currentSpread = observation.getSpreadBp();
        LocalDate date = observation.getDate();
        openPosition.markToMarket(currentSpread, date);

        ExitReasonType reason = exitReason(openPosition, currentSpread, median);
        if (reason == null) {
            return;
        }

        double pnlBp = openPosition.getPnlBp() - settings.getSpreadCostBp();
        double size = openPosition.getSize();
        double commission = size * settings.getCommissionRate() * 2; // вход + выход
        double pnlRub = pnlBp * size / 10000 - commission;

        openPosition.close(reason, date, currentSpread, observation.getYtmLong(), observation.getYtmShort(), pnlBp, pnlRub);
        capital += pnlRub;
        closedPositions.add(openPosition);
        equityCurve.add(EquityPoint.of(date, capital));
        log.debug("Пара {}: закрыта {} по {}, {} б.п., {} руб.", pairName, openPosition.getDirection(), reason,
                pnlBp, pnlRub);
        openPosition = null;
    }

    private ExitReasonType exitReason(Position position, double currentSpread, double median) {
        double pnlBp = position.getPnlBp();
        if (pnlBp <= -position.getStopLossBp()) {
            return ExitReasonType.STOP_LOSS;
        }
        if (pnlBp >= position.getTakeProfitBp()) {
            return ExitReasonType.TAKE_PROFIT;
        }
        boolean reverted = position.getDirection() == SignalDirection.LONG_SHORT
                ? currentSpread >= median
                : currentSpread <= median;
        if (reverted) {
            return ExitReasonType.MEAN_REVERSION;
        }
        if (position.getHoldingDays() >= settings.getMaxHoldingDays()) {
            return ExitReasonType.MAX_HOLDING;
        }
        return null;
    }

    private void tryOpen(SpreadObservation observation, double p10, double p90) {
        double spread = observation.getSpreadBp();
        SignalDirection direction;
        if (spread <= p10) {
            direction = SignalDirection.LONG_SHORT;
        } else if (spread >= p90) {
            direction = SignalDirection.SHORT_LONG;
        } else {
            return;
        }

        openPosition = Position.builder()
                .pairName(pairName)
                .direction(direction)
                .entryDate(observation.getDate())
                .entrySpread(spread)
                .entryYtmLong(observation.getYtmLong())
                .entryYtmShort(observation.getYtmShort())
                .size(capital * settings.getPositionSizePct())
                .stopLossBp(settings.getStopLossBp())
                .takeProfitBp(settings.getTakeProfitBp())
                .build();
        log.debug("Пара {}: открыта {} на {} б.п. ({})", pairName, direction, spread, observation.getDate());
    }
}
