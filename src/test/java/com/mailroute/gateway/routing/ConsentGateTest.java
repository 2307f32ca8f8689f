package com.mailroute.gateway.routing;

import com.mailroute.gateway.model.TaskType;
import com.mailroute.gateway.store.ConsentStatus;
import com.mailroute.gateway.store.ConsentStore;
import com.mailroute.gateway.store.InMemoryConsentStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConsentGateTest {

    private InMemoryConsentStore store;
    private ConsentGate          gate;

    @BeforeEach
    void setup() {
        store = new InMemoryConsentStore();
        gate  = new ConsentGate(store);
    }

    @ParameterizedTest
    @EnumSource(value = TaskType.class, names = {"AUTH_EMAILS", "TRANSACTIONAL_EMAILS"})
    void check_alwaysAllows_authAndTransactional_evenWhenRevoked(final TaskType type) {
        store.recordAll("u1", ConsentStatus.REVOKED);

        assertThat(gate.check("u1", type)).isTrue();
    }

    @Test
    void check_blocksMarketing_withoutExplicitOptIn() {
        assertThat(gate.check("u1", TaskType.MARKETING_EMAILS)).isFalse();

        store.record("u1", TaskType.MARKETING_EMAILS, ConsentStatus.GRANTED);
        assertThat(gate.check("u1", TaskType.MARKETING_EMAILS)).isTrue();
    }

    @Test
    void check_allowsOptOutCategories_untilRevoked() {
        assertThat(gate.check("u1", TaskType.NOTIFICATION_EMAILS)).isTrue();

        store.record("u1", TaskType.NOTIFICATION_EMAILS, ConsentStatus.REVOKED);

        assertThat(gate.check("u1", TaskType.NOTIFICATION_EMAILS)).isFalse();
        assertThat(gate.check("u1", TaskType.BILLING_EMAILS)).isTrue();
    }

    @Test
    void check_allowsAnything_whenNoUser() {
        assertThat(gate.check(null, TaskType.MARKETING_EMAILS)).isTrue();
        assertThat(gate.check(" ", TaskType.MARKETING_EMAILS)).isTrue();
    }

    @Test
    void check_skipsLookup_forAlwaysCategories() {
        final ConsentStore mockStore = mock(ConsentStore.class);

        new ConsentGate(mockStore).check("u1", TaskType.AUTH_EMAILS);

        verifyNoInteractions(mockStore);
    }

    @Test
    void check_treatsNullStatusAsUnknown() {
        final ConsentStore mockStore = mock(ConsentStore.class);
        when(mockStore.lookup("u1", TaskType.MARKETING_EMAILS)).thenReturn(null);

        assertThat(new ConsentGate(mockStore).check("u1", TaskType.MARKETING_EMAILS)).isFalse();
    }

    @Test
    void hasConsent_onlyCountsGranted() {
        store.record("u1", TaskType.REPORT_EMAILS, ConsentStatus.GRANTED);

        assertThat(store.hasConsent("u1", TaskType.REPORT_EMAILS)).isTrue();
        assertThat(store.hasConsent("u1", TaskType.SYSTEM_EMAILS)).isFalse();
    }
}
