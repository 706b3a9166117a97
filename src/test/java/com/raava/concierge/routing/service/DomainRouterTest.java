package com.raava.concierge.routing.service;

import com.raava.concierge.completion.service.TextCompletionClient;
import com.raava.concierge.dialogue.model.AcquisitionSlots;
import com.raava.concierge.dialogue.model.ServiceSlots;
import com.raava.concierge.exception.TextCompletionException;
import com.raava.concierge.routing.model.RoutingDecision;
import com.raava.concierge.routing.model.RoutingReason;
import com.raava.concierge.session.model.ActiveDomain;
import com.raava.concierge.session.model.SessionState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DomainRouterTest {

    private static final String CORRELATION_ID = "corr-router";

    @Mock
    private TextCompletionClient completionClient;

    @InjectMocks
    private DomainRouter domainRouter;

    @Test
    void testRoute_OpenFunnelIsSticky() {
        // Given
        SessionState session = SessionState.builder().sessionId("s-1").build();
        session.activate(ActiveDomain.SERVICE, new ServiceSlots());

        // When
        RoutingDecision decision = domainRouter.route("I want to buy a Ferrari", session, CORRELATION_ID);

        // Then
        assertEquals(ActiveDomain.SERVICE, decision.domain());
        assertEquals(RoutingReason.STICKY, decision.reason());
        verifyNoInteractions(completionClient);
    }

    @Test
    void testRoute_CompletedFunnelIsNotSticky() {
        // Given
        SessionState session = SessionState.builder().sessionId("s-1").build();
        AcquisitionSlots slots = new AcquisitionSlots();
        slots.setRecordCreated(true);
        session.activate(ActiveDomain.ACQUISITION, slots);

        // When
        RoutingDecision decision = domainRouter.route("My 911 needs a service", session, CORRELATION_ID);

        // Then
        assertEquals(ActiveDomain.SERVICE, decision.domain());
        assertEquals(RoutingReason.KEYWORD, decision.reason());
    }

    @Test
    void testRoute_KeywordPriority() {
        SessionState session = SessionState.builder().sessionId("s-1").build();

        assertEquals(ActiveDomain.ACQUISITION, domainRouter.route("I want to buy a Ferrari", session, CORRELATION_ID).domain());
        assertEquals(ActiveDomain.SERVICE, domainRouter.route("Book an MOT please", session, CORRELATION_ID).domain());
        assertEquals(ActiveDomain.CONSIGNMENT, domainRouter.route("I'd like to sell my car", session, CORRELATION_ID).domain());
        assertEquals(ActiveDomain.ACQUISITION, domainRouter.route("Lamborghini", session, CORRELATION_ID).domain());
        verifyNoInteractions(completionClient);
    }

    @Test
    void testRoute_Greeting() {
        // When
        RoutingDecision decision = domainRouter.route("Hello there!", SessionState.builder().build(), CORRELATION_ID);

        // Then
        assertFalse(decision.isRouted());
        assertEquals(RoutingReason.GREETING, decision.reason());
        verifyNoInteractions(completionClient);
    }

    @Test
    void testRoute_ClassifierLabel() {
        // Given
        when(completionClient.complete(anyString(), anyList())).thenReturn("CONSIGNMENT");

        // When
        RoutingDecision decision = domainRouter.route("What could I get for my old motor?", SessionState.builder().build(), CORRELATION_ID);

        // Then
        assertEquals(ActiveDomain.CONSIGNMENT, decision.domain());
        assertEquals(RoutingReason.CLASSIFIER, decision.reason());
    }

    @Test
    void testRoute_ClassifierUnknownLabelIsAmbiguous() {
        // Given
        when(completionClient.complete(anyString(), anyList())).thenReturn("NONE");

        // When
        RoutingDecision decision = domainRouter.route("What is the weather like?", SessionState.builder().build(), CORRELATION_ID);

        // Then
        assertFalse(decision.isRouted());
        assertEquals(RoutingReason.AMBIGUOUS, decision.reason());
    }

    @Test
    void testRoute_ClassifierFailureIsAmbiguous() {
        // Given
        when(completionClient.complete(anyString(), anyList())).thenThrow(new TextCompletionException("timeout"));

        // When
        RoutingDecision decision = domainRouter.route("Can you help me with something?", SessionState.builder().build(), CORRELATION_ID);

        // Then
        assertNull(decision.domain());
        assertEquals(RoutingReason.AMBIGUOUS, decision.reason());
    }
}
