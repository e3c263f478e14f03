package com.iudex.cograg.rag.cograg.refiner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LegalContradictionPolicyTest {

    private final LegalContradictionPolicy policy = new LegalContradictionPolicy();

    @Test
    void shouldFlagNegatedApplicability() {
        List<String> signals = policy.signals("A multa se aplica aos contratos de locação.",
                "A multa não se aplica aos contratos de locação residencial.");

        assertEquals(List.of("negated applicability"), signals);
    }

    @Test
    void shouldFlagOppositeVerdictOnSharedReference() {
        List<String> signals = policy.signals("O art. 24 da Lei 8.666 permite a contratação direta.",
                "O art. 24 da Lei 8.666 veda a contratação direta nessa hipótese.");

        assertEquals(List.of("opposite verdict on art. 24, lei 8.666"), signals);
    }

    @Test
    void shouldIgnoreVerdictsOnDifferentReferences() {
        assertFalse(policy.conflicts("O art. 24 permite a contratação direta.", "O art. 75 veda a prorrogação."));
    }

    @Test
    void shouldIgnoreAgreeingOrEmptyTexts() {
        assertFalse(policy.conflicts("O prazo é de cinco anos.", "O prazo prescricional é quinquenal."));
        assertTrue(policy.signals(null, "qualquer").isEmpty());
        assertTrue(policy.signals("", "qualquer").isEmpty());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "O benefício é permitido salvo dolo|O benefício é permitido",
            "A cláusula é válida segundo o art. 51|A cláusula é inválida segundo o art. 51",
            "Does not apply to public entities|Applies to public entities unless excluded",
            "Entendimento contrário ao STJ|Entendimento alinhado ao STJ"})
    void shouldBeSymmetric(String first, String second) {
        List<String> forward = policy.signals(first, second);
        List<String> backward = policy.signals(second, first);

        assertThat(forward).isNotEmpty();
        assertEquals(forward, backward);
    }
}
