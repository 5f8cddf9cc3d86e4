package com.oraclex.relay.service;

import com.oraclex.relay.model.PendingSignal;
import com.oraclex.relay.model.TradeSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Writes the operator alert to the application log. Swap in another
 * {@link SignalNotifier} bean to deliver it to a messenger.
 */
@Component
@Slf4j
public class LoggingSignalNotifier implements SignalNotifier {

    static final int INDICATOR_TOTAL = 7;

    @Override
    public void signalPending(PendingSignal pending, long approvalWindowSeconds) {
        log.info("Signal {} awaiting approval ({}s window)\n{}", pending.getCmdId(), approvalWindowSeconds,
                formatAlert(pending.getSignal()));
    }

    static String formatAlert(TradeSignal signal) {
        int green = signal.getGreenCount() != null ? signal.getGreenCount() : 0;
        return signal.getSymbol() + " " + signal.getAction() + "\n"
                + "Confidence: " + (signal.getConfidence() != null ? signal.getConfidence() : 0) + "%\n"
                + green + "/" + INDICATOR_TOTAL + " indicators\n"
                + "Entry: " + price(signal.getEntry()) + "\n"
                + "SL: " + price(signal.getSl()) + "\n"
                + "TP: " + price(signal.getTp()) + "\n"
                + "Session: " + (signal.getCurrentSession() != null ? signal.getCurrentSession() : "Unknown");
    }

    private static String price(Double value) {
        return value != null ? String.format(Locale.ROOT, "%.5f", value) : "-";
    }
}
