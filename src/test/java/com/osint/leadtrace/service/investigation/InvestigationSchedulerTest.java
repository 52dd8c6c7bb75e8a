package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.exception.SearchExecutionException;
import com.osint.leadtrace.service.graph.IdentityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InvestigationSchedulerTest {

    private static final String PROJECT = "project-1";
    private static final String SEED = "alice@example.com";
    private static final String REASON = "found_with_verified_entities:1x";

    @Mock
    private QueueBuilder queueBuilder;

    @Mock
    private SequenceTagger sequenceTagger;

    @Mock
    private VerificationEvaluator verificationEvaluator;

    @Mock
    private PromotionApplier promotionApplier;

    @Mock
    private SearchedMarker searchedMarker;

    @Mock
    private SearchExecutor searchExecutor;

    private InvestigationScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new InvestigationScheduler(queueBuilder, sequenceTagger, verificationEvaluator,
                promotionApplier, searchedMarker, searchExecutor, new IdentityRegistry());
    }

    @Test
    void rejectsMissingSearchExecutor() {
        assertThatThrownBy(() -> new InvestigationScheduler(queueBuilder, sequenceTagger, verificationEvaluator,
                promotionApplier, searchedMarker, null, new IdentityRegistry()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verifiedLeadsTakePrecedence_unverifiedPhaseSkipped() {
        when(queueBuilder.build(eq(PROJECT), any(IdentityRegistry.class)))
                .thenReturn(queues(List.of("bob_phone"), lead("carol_user", "carol_user_1")))
                .thenReturn(PriorityQueues.empty());

        InvestigationSummary summary = scheduler.run(SEED, PROJECT, 3);

        InOrder inOrder = inOrder(searchExecutor, queueBuilder, searchedMarker);
        inOrder.verify(searchExecutor).search(SEED);
        inOrder.verify(queueBuilder).build(eq(PROJECT), any(IdentityRegistry.class));
        inOrder.verify(searchExecutor).search("bob_phone");
        inOrder.verify(searchedMarker).markSearched(eq(PROJECT), eq("bob_phone"), any(IdentityRegistry.class));
        inOrder.verify(queueBuilder).build(eq(PROJECT), any(IdentityRegistry.class));

        verify(searchExecutor, never()).search("carol_user");
        verifyNoInteractions(sequenceTagger, verificationEvaluator, promotionApplier);

        assertThat(summary.getTotalSearches()).isEqualTo(2);
        assertThat(summary.getVerifiedSearches()).isEqualTo(1);
        assertThat(summary.getUnverifiedSearches()).isZero();
        assertThat(summary.getFinalDepth()).isEqualTo(1);
        assertThat(summary.isFailed()).isFalse();
    }

    @Test
    void cascadeSearchesPromotedEntitiesMostRecentFirst() {
        when(queueBuilder.build(eq(PROJECT), any(IdentityRegistry.class)))
                .thenReturn(queues(List.of(), lead("A", "A_1"), lead("B", "B_1"), lead("C", "C_1")))
                .thenReturn(PriorityQueues.empty());
        when(sequenceTagger.increment(anyString(), anyString()))
                .thenAnswer(invocation -> invocation.getArgument(0) + "_2");
        when(verificationEvaluator.check(anyString(), eq(PROJECT), any(IdentityRegistry.class)))
                .thenAnswer(invocation -> "A".equals(invocation.getArgument(0))
                        ? VerificationDecision.rejected(VerificationDecision.NO_VERIFIED_CONNECTIONS)
                        : new VerificationDecision(true, REASON, List.of("cooccurs_with_verified:n-9")));
        when(promotionApplier.apply(anyString(), eq(PROJECT), eq(REASON), any(IdentityRegistry.class)))
                .thenReturn(new PromotionResult(true, 1, 1, 1, 0));

        InvestigationSummary summary = scheduler.run(SEED, PROJECT, 3);

        ArgumentCaptor<String> searched = ArgumentCaptor.forClass(String.class);
        verify(searchExecutor, times(6)).search(searched.capture());
        assertThat(searched.getAllValues()).containsExactly(SEED, "A", "B", "C", "C", "B");

        InOrder inOrder = inOrder(searchExecutor, queueBuilder);
        inOrder.verify(searchExecutor).search(SEED);
        inOrder.verify(queueBuilder).build(eq(PROJECT), any(IdentityRegistry.class));
        inOrder.verify(searchExecutor).search("A");
        inOrder.verify(searchExecutor).search("B");
        inOrder.verify(searchExecutor, times(2)).search("C");
        inOrder.verify(searchExecutor).search("B");
        inOrder.verify(queueBuilder).build(eq(PROJECT), any(IdentityRegistry.class));

        verify(promotionApplier, never()).apply(eq("A"), anyString(), anyString(), any(IdentityRegistry.class));
        verify(searchedMarker, never()).markSearched(anyString(), eq("A"), any(IdentityRegistry.class));
        verify(sequenceTagger).applyTag(PROJECT, "A", "A_1", "A_2");
        verify(sequenceTagger).applyTag(PROJECT, "B", "B_1", "B_2");
        verify(sequenceTagger).applyTag(PROJECT, "C", "C_1", "C_2");

        assertThat(summary.getTotalSearches()).isEqualTo(6);
        assertThat(summary.getUnverifiedSearches()).isEqualTo(3);
        assertThat(summary.getVerifiedSearches()).isEqualTo(2);
        assertThat(summary.getUpgradedCount()).isEqualTo(2);
        assertThat(summary.getPromotions())
                .extracting(Promotion::getEntityValue)
                .containsExactly("B", "C");
        assertThat(summary.getDiagnostics()).containsExactly("A: no_verified_connections");
        assertThat(summary.getFinalDepth()).isEqualTo(1);
    }

    @Test
    void leadWithoutCorroborationStaysUnverified() {
        when(queueBuilder.build(eq(PROJECT), any(IdentityRegistry.class)))
                .thenReturn(queues(List.of(), lead("carol_user", "carol_user_1")))
                .thenReturn(PriorityQueues.empty());
        when(sequenceTagger.increment("carol_user", "carol_user_1")).thenReturn("carol_user_2");
        when(verificationEvaluator.check(eq("carol_user"), eq(PROJECT), any(IdentityRegistry.class)))
                .thenReturn(VerificationDecision.rejected(VerificationDecision.NO_VERIFIED_CONNECTIONS));

        InvestigationSummary summary = scheduler.run(SEED, PROJECT, 3);

        verifyNoInteractions(promotionApplier);
        assertThat(summary.getUnverifiedSearches()).isEqualTo(1);
        assertThat(summary.getUpgradedCount()).isZero();
        assertThat(summary.getDiagnostics()).containsExactly("carol_user: no_verified_connections");
    }

    @Test
    void failedPromotionIsNotCountedOrCascaded() {
        when(queueBuilder.build(eq(PROJECT), any(IdentityRegistry.class)))
                .thenReturn(queues(List.of(), lead("carol_user", "carol_user_1")))
                .thenReturn(PriorityQueues.empty());
        when(sequenceTagger.increment("carol_user", "carol_user_1")).thenReturn("carol_user_2");
        when(verificationEvaluator.check(eq("carol_user"), eq(PROJECT), any(IdentityRegistry.class)))
                .thenReturn(new VerificationDecision(true, REASON, List.of("same_breach_record:n-1")));
        when(promotionApplier.apply(eq("carol_user"), eq(PROJECT), eq(REASON), any(IdentityRegistry.class)))
                .thenReturn(PromotionResult.failed());

        InvestigationSummary summary = scheduler.run(SEED, PROJECT, 3);

        verify(searchExecutor, times(1)).search("carol_user");
        assertThat(summary.getUpgradedCount()).isZero();
        assertThat(summary.getVerifiedSearches()).isZero();
        assertThat(summary.getDiagnostics()).containsExactly("carol_user: promotion_failed");
    }

    @Test
    void failedUnverifiedSearchSkipsEvaluation() {
        when(queueBuilder.build(eq(PROJECT), any(IdentityRegistry.class)))
                .thenReturn(queues(List.of(), lead("carol_user", "carol_user_1")))
                .thenReturn(PriorityQueues.empty());
        when(sequenceTagger.increment("carol_user", "carol_user_1")).thenReturn("carol_user_2");
        lenient().doThrow(new SearchExecutionException("carol_user", "lookup timed out"))
                .when(searchExecutor).search("carol_user");

        InvestigationSummary summary = scheduler.run(SEED, PROJECT, 3);

        verifyNoInteractions(verificationEvaluator, promotionApplier);
        assertThat(summary.getTotalSearches()).isEqualTo(1);
        assertThat(summary.getUnverifiedSearches()).isZero();
        assertThat(summary.getDiagnostics()).containsExactly("carol_user: search_failed: lookup timed out");
    }

    @Test
    void failedVerifiedSearchIsSkipped_andLoopContinues() {
        when(queueBuilder.build(eq(PROJECT), any(IdentityRegistry.class)))
                .thenReturn(queues(List.of("bob_phone", "dan@example.com")))
                .thenReturn(PriorityQueues.empty());
        lenient().doThrow(new SearchExecutionException("bob_phone", "502 from lookup service"))
                .when(searchExecutor).search("bob_phone");

        InvestigationSummary summary = scheduler.run(SEED, PROJECT, 3);

        verify(searchExecutor).search("dan@example.com");
        verify(searchedMarker, never()).markSearched(eq(PROJECT), eq("bob_phone"), any(IdentityRegistry.class));
        assertThat(summary.getVerifiedSearches()).isEqualTo(1);
        assertThat(summary.getTotalSearches()).isEqualTo(2);
        assertThat(summary.getFinalDepth()).isEqualTo(1);
    }

    @Test
    void stopsEarly_whenQueuesRunDry() {
        when(queueBuilder.build(eq(PROJECT), any(IdentityRegistry.class)))
                .thenReturn(queues(List.of("bob_phone")))
                .thenReturn(queues(List.of("carol@example.com")))
                .thenReturn(PriorityQueues.empty());

        InvestigationSummary summary = scheduler.run(SEED, PROJECT, 5);

        verify(queueBuilder, times(3)).build(eq(PROJECT), any(IdentityRegistry.class));
        assertThat(summary.getFinalDepth()).isEqualTo(2);
        assertThat(summary.getVerifiedSearches()).isEqualTo(2);
    }

    @Test
    void stopsAtMaxDepth_whenWorkRemains() {
        when(queueBuilder.build(eq(PROJECT), any(IdentityRegistry.class)))
                .thenReturn(queues(List.of("bob_phone")));

        InvestigationSummary summary = scheduler.run(SEED, PROJECT, 3);

        verify(queueBuilder, times(3)).build(eq(PROJECT), any(IdentityRegistry.class));
        assertThat(summary.getFinalDepth()).isEqualTo(3);
        assertThat(summary.getTotalSearches()).isEqualTo(4);
    }

    @Test
    void seedFailureReturnsDegenerateSummary() {
        doThrow(new SearchExecutionException(SEED, "lookup service unreachable"))
                .when(searchExecutor).search(SEED);

        InvestigationSummary summary = scheduler.run(SEED, PROJECT, 3);

        verifyNoInteractions(queueBuilder, searchedMarker);
        assertThat(summary.isFailed()).isTrue();
        assertThat(summary.getError()).isEqualTo("seed_search_failed: lookup service unreachable");
        assertThat(summary.getTotalSearches()).isZero();
        assertThat(summary.getFinalDepth()).isZero();
    }

    @Test
    void unexpectedFailureAbortsWithoutThrowing() {
        when(queueBuilder.build(eq(PROJECT), any(IdentityRegistry.class)))
                .thenThrow(new IllegalStateException("corrupt document"));

        InvestigationSummary summary = scheduler.run(SEED, PROJECT, 3);

        assertThat(summary.getError()).isEqualTo("aborted_at_depth_1: corrupt document");
        assertThat(summary.getTotalSearches()).isEqualTo(1);
        assertThat(summary.getFinalDepth()).isZero();
    }

    private static PriorityQueues queues(List<String> verified, UnverifiedLead... unverified) {
        return new PriorityQueues(new ArrayList<>(verified), new ArrayList<>(List.of(unverified)));
    }

    private static UnverifiedLead lead(String value, String tag) {
        return new UnverifiedLead(value, tag);
    }
}
