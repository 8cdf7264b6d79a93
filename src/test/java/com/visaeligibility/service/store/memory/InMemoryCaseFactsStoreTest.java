package com.visaeligibility.service.store.memory;

import com.visaeligibility.model.Fact;
import com.visaeligibility.model.FactValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCaseFactsStoreTest {

    private final InMemoryCaseFactsStore store = new InMemoryCaseFactsStore();

    @Test
    @DisplayName("facts are served by key and keep their source")
    void storesFacts() {
        store.putFacts("case-001", List.of(
                new Fact("case-001", "salary", FactValue.of(45000), "payslip"),
                new Fact("case-001", "sponsor", FactValue.of(true), "employer_letter")));

        assertThat(store.getFacts("case-001"))
                .containsEntry("salary", FactValue.of(45000))
                .containsEntry("sponsor", FactValue.of(true));
        assertThat(store.findFact("case-001", "salary")).get()
                .extracting(Fact::source)
                .isEqualTo("payslip");
    }

    @Test
    @DisplayName("a fact of another case is rejected")
    void foreignFact() {
        List<Fact> facts = List.of(new Fact("case-002", "salary", FactValue.of(30000), "payslip"));

        assertThatThrownBy(() -> store.putFacts("case-001", facts))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.getFacts("case-001")).isEmpty();
    }

    @Test
    @DisplayName("an unknown case has no facts")
    void unknownCase() {
        assertThat(store.getFacts("case-404")).isEmpty();
        assertThat(store.findFact("case-404", "salary")).isEmpty();
    }
}
