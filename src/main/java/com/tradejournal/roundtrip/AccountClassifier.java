package com.tradejournal.roundtrip;

import com.tradejournal.config.JournalConfig;
import com.tradejournal.domain.enums.AccountType;
import java.util.Collection;
import org.springframework.stereotype.Component;

/**
 * Classifies the accounts touched by a round trip as live, training or mixed.
 *
 * <p>An account is a training account when its name starts with the configured prefix. A blank prefix
 * disables training detection and every account is live.
 */
@Component
public class AccountClassifier {

    private final String trainingPrefix;

    public AccountClassifier(JournalConfig journalConfig) {
        String prefix = journalConfig.getTrainingAccountPrefix();
        this.trainingPrefix = prefix == null ? "" : prefix.trim();
    }

    public AccountType classify(Collection<String> accounts) {
        boolean hasTraining = false;
        boolean hasLive = false;
        for (String account : accounts) {
            if (isTraining(account)) {
                hasTraining = true;
            } else {
                hasLive = true;
            }
        }
        if (hasTraining && hasLive) {
            return AccountType.MIXED;
        }
        return hasTraining ? AccountType.TRAINING : AccountType.LIVE;
    }

    public boolean isTraining(String account) {
        return !trainingPrefix.isEmpty() && account != null && account.startsWith(trainingPrefix);
    }
}
