package com.tradesim.engine;

import com.tradesim.core.model.Bar;
import com.tradesim.core.model.ExitReason;
import com.tradesim.core.model.ExitSettings;
import com.tradesim.core.model.TrailingStopSettings;

/**
 * Decides, once per bar, whether the open position should be closed.
 *
 * Triggers, in evaluation order:
 * <ol>
 *   <li>Stop-loss: bar low reached {@code entry * (1 - stopLoss)}; fills at that price.</li>
 *   <li>Take-profit: bar high reached {@code entry * (1 + takeProfit)}; fills at that price.</li>
 *   <li>Trailing stop: armed position whose close fell {@code trailPct} of entry below the peak; fills at close.</li>
 *   <li>Timeout: bar time is at least {@code maxHoldDuration} after entry; fills at close.</li>
 * </ol>
 * Stop-loss is checked before take-profit, so a bar whose range hits both
 * thresholds always exits as a stop-loss.
 *
 * Pure: reads the position and never changes it or any capital.
 */
public class ExitPolicyEvaluator {

    public Decision evaluate(Position position, Bar bar, ExitSettings settings) {
        double entryPrice = position.getEntryPrice();

        if (settings.hasStopLoss()) {
            double drop = (entryPrice - bar.low()) / entryPrice;
            if (drop >= settings.stopLoss()) {
                return Decision.exit(ExitReason.STOP_LOSS, entryPrice * (1 - settings.stopLoss()));
            }
        }

        if (settings.hasTakeProfit()) {
            double gain = (bar.high() - entryPrice) / entryPrice;
            if (gain >= settings.takeProfit()) {
                return Decision.exit(ExitReason.TAKE_PROFIT, entryPrice * (1 + settings.takeProfit()));
            }
        }

        if (settings.hasTrailingStop() && position.isTrailingArmed()) {
            TrailingStopSettings trailing = settings.trailingStop();
            double giveBack = (position.getPeakPriceSinceEntry() - bar.close()) / entryPrice;
            if (giveBack >= trailing.trailPct()) {
                return Decision.exit(ExitReason.TRAILING_STOP, bar.close());
            }
        }

        if (settings.hasTimeout()) {
            long elapsed = bar.timestamp() - position.getEntryTime();
            if (elapsed >= settings.maxHoldDuration().toMillis()) {
                return Decision.exit(ExitReason.TIMEOUT, bar.close());
            }
        }

        return Decision.hold();
    }
}
