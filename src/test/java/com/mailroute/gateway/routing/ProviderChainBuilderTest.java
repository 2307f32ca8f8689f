package com.mailroute.gateway.routing;

import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.TaskRouting;
import com.mailroute.gateway.model.TaskType;
import com.mailroute.gateway.store.InMemoryProviderStore;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class ProviderChainBuilderTest {

    private InMemoryProviderStore store;
    private ProviderHealthTracker tracker;
    private ProviderChainBuilder  builder;

    @BeforeEach
    void setup() {
        store   = new InMemoryProviderStore();
        tracker = new ProviderHealthTracker(store);
        builder = new ProviderChainBuilder(store, tracker);
        for (final String id : List.of("p1", "p2", "p3")) {
            store.saveProvider(EmailProvider.builder(id).build());
        }
    }

    @Test
    void build_keepsDeclaredOrder_primaryFirst() {
        final List<EmailProvider> chain = builder.build(TaskRouting.builder(TaskType.BILLING_EMAILS)
                .primary("p3")
                .fallbacks("p1", "p2")
                .build());

        assertThat(ids(chain)).containsExactly("p3", "p1", "p2");
    }

    @Test
    void build_ignoresPriorityOrder_ofProviderRecords() {
        store.saveProvider(EmailProvider.builder("p1").priorityOrder(1).build());
        store.saveProvider(EmailProvider.builder("p2").priorityOrder(9).build());

        final List<EmailProvider> chain = builder.build(TaskRouting.builder(TaskType.BILLING_EMAILS)
                .primary("p2")
                .fallbacks("p1")
                .build());

        assertThat(ids(chain)).containsExactly("p2", "p1");
    }

    @Test
    void build_dropsDuplicates() {
        final List<EmailProvider> chain = builder.build(TaskRouting.builder(TaskType.BILLING_EMAILS)
                .primary("p1")
                .fallbacks("p2", "p1", "p2")
                .build());

        assertThat(ids(chain)).containsExactly("p1", "p2");
    }

    @Test
    void build_skipsUnknownInactiveAndUnhealthyProviders() {
        store.saveProvider(EmailProvider.builder("p2").active(false).build());
        final EmailProvider p3 = store.getProvider("p3").orElseThrow();
        for (int i = 0; i < ProviderHealthTracker.FAILURE_THRESHOLD; i++) {
            tracker.recordFailure(p3, "down");
        }

        final List<EmailProvider> chain = builder.build(TaskRouting.builder(TaskType.BILLING_EMAILS)
                .primary("ghost")
                .fallbacks("p1", "p2", "p3")
                .build());

        assertThat(ids(chain)).containsExactly("p1");
    }

    @Test
    void build_returnsOnlyForcedProvider_evenWhenUnhealthy() {
        final EmailProvider p2 = store.getProvider("p2").orElseThrow();
        for (int i = 0; i < ProviderHealthTracker.FAILURE_THRESHOLD; i++) {
            tracker.recordFailure(p2, "down");
        }

        final List<EmailProvider> chain = builder.build(TaskRouting.builder(TaskType.AUTH_EMAILS)
                .primary("p1")
                .fallbacks("p3")
                .forceProvider("p2")
                .build());

        assertThat(ids(chain)).containsExactly("p2");
    }

    @Test
    void build_returnsEmpty_whenForcedProviderInactiveOrMissing() {
        store.saveProvider(EmailProvider.builder("p2").active(false).build());

        assertThat(builder.build(TaskRouting.builder(TaskType.AUTH_EMAILS)
                .primary("p1").forceProvider("p2").build())).isEmpty();
        assertThat(builder.build(TaskRouting.builder(TaskType.AUTH_EMAILS)
                .primary("p1").forceProvider("ghost").build())).isEmpty();
    }

    @Test
    void build_worksWithFallbacksOnly() {
        final List<EmailProvider> chain = builder.build(TaskRouting.builder(TaskType.REPORT_EMAILS)
                .fallbacks("p2")
                .build());

        assertThat(ids(chain)).containsExactly("p2");
    }

    private static List<String> ids(final List<EmailProvider> chain) {
        return chain.stream().map(EmailProvider::getId).collect(Collectors.toList());
    }
}
