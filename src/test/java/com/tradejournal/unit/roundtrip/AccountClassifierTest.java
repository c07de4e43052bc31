package com.tradejournal.unit.roundtrip;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.config.JournalConfig;
import com.tradejournal.domain.enums.AccountType;
import com.tradejournal.roundtrip.AccountClassifier;
import java.util.List;
import org.junit.jupiter.api.Test;

class AccountClassifierTest {

    private final AccountClassifier classifier = new AccountClassifier(new JournalConfig());

    @Test
    void liveOnly() {
        assertThat(classifier.classify(List.of("A1", "B2"))).isEqualTo(AccountType.LIVE);
    }

    @Test
    void trainingOnly() {
        assertThat(classifier.classify(List.of("TR1", "TR2"))).isEqualTo(AccountType.TRAINING);
    }

    @Test
    void liveAndTrainingIsMixed() {
        assertThat(classifier.classify(List.of("A1", "TR1"))).isEqualTo(AccountType.MIXED);
    }

    @Test
    void emptyAccountSetIsLive() {
        assertThat(classifier.classify(List.of())).isEqualTo(AccountType.LIVE);
    }

    @Test
    void prefixIsCaseSensitive() {
        assertThat(classifier.classify(List.of("tr1"))).isEqualTo(AccountType.LIVE);
    }

    @Test
    void customPrefix() {
        JournalConfig config = new JournalConfig();
        config.setTrainingAccountPrefix("SIM");
        AccountClassifier custom = new AccountClassifier(config);

        assertThat(custom.classify(List.of("SIM01"))).isEqualTo(AccountType.TRAINING);
        assertThat(custom.classify(List.of("TR1"))).isEqualTo(AccountType.LIVE);
    }

    @Test
    void blankPrefixTreatsEverythingAsLive() {
        JournalConfig config = new JournalConfig();
        config.setTrainingAccountPrefix("");
        AccountClassifier custom = new AccountClassifier(config);

        assertThat(custom.classify(List.of("TR1", "A1"))).isEqualTo(AccountType.LIVE);
    }
}
