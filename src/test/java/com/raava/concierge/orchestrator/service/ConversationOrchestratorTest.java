package com.raava.concierge.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raava.concierge.completion.service.TextCompletionClient;
import com.raava.concierge.dialogue.machine.AcquisitionMachine;
import com.raava.concierge.dialogue.model.AcquisitionSlots;
import com.raava.concierge.dialogue.model.DomainSlots;
import com.raava.concierge.exception.PersistenceException;
import com.raava.concierge.exception.TextCompletionException;
import com.raava.concierge.extraction.detector.ConfirmationDetector;
import com.raava.concierge.extraction.detector.ContactFactDetector;
import com.raava.concierge.extraction.detector.DateTimeDetector;
import com.raava.concierge.extraction.detector.DomainHintDetector;
import com.raava.concierge.extraction.detector.FinancePreferenceDetector;
import com.raava.concierge.extraction.detector.FreeTextAnswerDetector;
import com.raava.concierge.extraction.detector.OptionChoiceDetector;
import com.raava.concierge.extraction.detector.PriceDetector;
import com.raava.concierge.extraction.detector.ServiceRequestDetector;
import com.raava.concierge.extraction.detector.VehicleFactDetector;
import com.raava.concierge.extraction.service.IntentExtractor;
import com.raava.concierge.finance.service.FinanceOfferService;
import com.raava.concierge.gateway.dto.ChatResponse;
import com.raava.concierge.gateway.model.RequestContext;
import com.raava.concierge.inventory.model.SearchCriteria;
import com.raava.concierge.inventory.model.VehicleListing;
import com.raava.concierge.inventory.service.VehicleSearchProvider;
import com.raava.concierge.repository.InMemoryRecordStore;
import com.raava.concierge.routing.service.DomainRouter;
import com.raava.concierge.session.model.ActiveDomain;
import com.raava.concierge.session.model.SessionState;
import com.raava.concierge.session.service.SessionStore;
import com.raava.concierge.transaction.model.TransactionResult;
import com.raava.concierge.transaction.service.TransactionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationOrchestratorTest {

    private static final String SESSION_ID = "session-abc-123";
    private static final String ORDER_ID = "ORD-RA-2026-AB12C";

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private TextCompletionClient completionClient;

    @Mock
    private VehicleSearchProvider vehicleSearchProvider;

    @Mock
    private FinanceOfferService financeOfferService;

    @Mock
    private TransactionManager transactionManager;

    private SessionStore sessionStore;
    private ConversationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        sessionStore = new SessionStore(new InMemoryRecordStore(), new ObjectMapper().findAndRegisterModules(),
                clock, Duration.ofMinutes(60), 100, 20);
        IntentExtractor intentExtractor = new IntentExtractor(List.of(
                new FreeTextAnswerDetector(),
                new OptionChoiceDetector(),
                new VehicleFactDetector(clock),
                new ContactFactDetector(),
                new DateTimeDetector(clock),
                new ConfirmationDetector(),
                new DomainHintDetector(),
                new ServiceRequestDetector(),
                new FinancePreferenceDetector(),
                new PriceDetector()));
        orchestrator = new ConversationOrchestrator(
                sessionStore,
                new DomainRouter(completionClient),
                intentExtractor,
                transactionManager,
                new ReplyComposer(completionClient, false),
                clock,
                List.of(new AcquisitionMachine(vehicleSearchProvider, financeOfferService)));
    }

    @Test
    void testOrchestrate_Greeting() {
        // When
        ChatResponse response = orchestrator.orchestrate(context("Hello"));

        // Then
        assertEquals(ConversationOrchestrator.GREETING_REPLY, response.getAnswer());
        assertEquals(ActiveDomain.NONE, response.getDomain());
        assertEquals(List.of(), response.getMissingFields());
        assertEquals(1, sessionStore.fetchOrCreate(SESSION_ID).getHistory().size());
        verifyNoInteractions(completionClient, transactionManager);
    }

    @Test
    void testOrchestrate_AmbiguousMessageAsksWhichService() {
        // Given
        when(completionClient.complete(anyString(), anyList())).thenThrow(new TextCompletionException("not configured"));

        // When
        ChatResponse response = orchestrator.orchestrate(context("Can you help me with something?"));

        // Then
        assertEquals(ConversationOrchestrator.CLARIFYING_REPLY, response.getAnswer());
        assertEquals(ActiveDomain.NONE, sessionStore.fetchOrCreate(SESSION_ID).getActiveDomain());
    }

    @Test
    void testOrchestrate_PurchaseCreatesOrderAndClearsFunnel() {
        // Given
        stubFerrariSearch();
        when(transactionManager.create(any(DomainSlots.class), eq(SESSION_ID), eq("corr-1")))
                .thenReturn(new TransactionResult.Created(ORDER_ID, "Your order " + ORDER_ID + " is confirmed.", List.of()));

        // When
        ChatResponse search = orchestrator.orchestrate(context("I want to buy a Ferrari"));
        ChatResponse pick = orchestrator.orchestrate(context("1"));
        ChatResponse done = orchestrator.orchestrate(context("John Smith, john@x.com, 07700900123"));

        // Then
        assertEquals("VEHICLE_SELECTION", search.getStage());
        assertEquals(ActiveDomain.ACQUISITION, search.getDomain());
        assertTrue(search.getAnswer().contains("1. 2022 Ferrari Roma"));
        assertEquals("CUSTOMER_INFO", pick.getStage());
        assertEquals(List.of("Full name", "Email address", "Phone number"), pick.getMissingFields());
        assertEquals(ORDER_ID, done.getRecordId());
        assertEquals("Your order " + ORDER_ID + " is confirmed.", done.getAnswer());
        assertEquals(ActiveDomain.ACQUISITION, done.getDomain());

        ArgumentCaptor<DomainSlots> slots = ArgumentCaptor.forClass(DomainSlots.class);
        verify(transactionManager, times(1)).create(slots.capture(), eq(SESSION_ID), eq("corr-1"));
        AcquisitionSlots submitted = (AcquisitionSlots) slots.getValue();
        assertEquals("INV-2001", submitted.getSelectedVehicle().getId());
        assertEquals("John Smith", submitted.getContact().getName());
        assertEquals("07700900123", submitted.getContact().getPhone());

        SessionState session = sessionStore.fetchOrCreate(SESSION_ID);
        assertEquals(ActiveDomain.NONE, session.getActiveDomain());
        assertNull(session.getSlots());
        assertEquals(List.of(ORDER_ID), session.getCompletedRecords());
        assertEquals(3, session.getHistory().size());
    }

    @Test
    void testOrchestrate_PersistenceFailureLeavesSessionUntouched() {
        // Given
        stubFerrariSearch();
        when(transactionManager.create(any(DomainSlots.class), eq(SESSION_ID), anyString()))
                .thenThrow(new PersistenceException("store unavailable", new IllegalStateException("down")))
                .thenReturn(new TransactionResult.Created(ORDER_ID, "Confirmed", List.of()));
        orchestrator.orchestrate(context("I want to buy a Ferrari"));
        orchestrator.orchestrate(context("1"));

        // When
        ChatResponse failed = orchestrator.orchestrate(context("John Smith, john@x.com, 07700900123"));

        // Then
        assertTrue(failed.isRetryable());
        assertEquals(ConversationOrchestrator.RETRY_REPLY, failed.getAnswer());
        assertNull(failed.getRecordId());
        SessionState stored = sessionStore.fetchOrCreate(SESSION_ID);
        assertEquals(2, stored.getHistory().size());
        AcquisitionSlots storedSlots = (AcquisitionSlots) stored.getSlots();
        assertEquals("CUSTOMER_INFO", storedSlots.stageName());
        assertNull(storedSlots.getContact().getName());

        // When the same message is sent again
        ChatResponse retried = orchestrator.orchestrate(context("John Smith, john@x.com, 07700900123"));

        // Then
        assertFalse(retried.isRetryable());
        assertEquals(ORDER_ID, retried.getRecordId());
        verify(transactionManager, times(2)).create(any(DomainSlots.class), eq(SESSION_ID), anyString());
    }

    @Test
    void testOrchestrate_IncompleteRecordKeepsFunnelOpen() {
        // Given
        stubFerrariSearch();
        when(transactionManager.create(any(DomainSlots.class), eq(SESSION_ID), anyString()))
                .thenReturn(new TransactionResult.Incomplete(List.of("Phone number")));
        orchestrator.orchestrate(context("I want to buy a Ferrari"));
        orchestrator.orchestrate(context("1"));

        // When
        ChatResponse response = orchestrator.orchestrate(context("John Smith, john@x.com, 07700900123"));

        // Then
        assertEquals("Before I can finish, I still need your phone number.", response.getAnswer());
        assertEquals(List.of("Phone number"), response.getMissingFields());
        assertNull(response.getRecordId());
        assertEquals(ActiveDomain.ACQUISITION, sessionStore.fetchOrCreate(SESSION_ID).getActiveDomain());
    }

    @Test
    void testOrchestrate_UndeliveredConfirmationIsMentioned() {
        // Given
        stubFerrariSearch();
        when(transactionManager.create(any(DomainSlots.class), eq(SESSION_ID), anyString()))
                .thenReturn(new TransactionResult.Created(ORDER_ID, "Confirmed",
                        List.of("We could not send your confirmation email.")));
        orchestrator.orchestrate(context("I want to buy a Ferrari"));
        orchestrator.orchestrate(context("1"));

        // When
        ChatResponse response = orchestrator.orchestrate(context("John Smith, john@x.com, 07700900123"));

        // Then
        assertEquals("Confirmed\n\nWe could not send your confirmation email.", response.getAnswer());
        assertEquals(ORDER_ID, response.getRecordId());
    }

    private void stubFerrariSearch() {
        when(vehicleSearchProvider.search(any(SearchCriteria.class))).thenReturn(List.of(
                listing("INV-2001", "Roma", 2022, 189_500.0),
                listing("INV-2002", "F8 Tributo", 2021, 239_000.0)));
    }

    private static RequestContext context(String message) {
        return RequestContext.builder()
                .sessionId(SESSION_ID)
                .correlationId("corr-1")
                .messageText(message)
                .receivedAt(Instant.parse("2026-01-15T10:00:00Z"))
                .build();
    }

    private static VehicleListing listing(String id, String model, int year, double price) {
        return VehicleListing.builder()
                .id(id)
                .make("Ferrari")
                .model(model)
                .year(year)
                .price(price)
                .mileage(5_000)
                .location("London")
                .source("Raava Inventory")
                .build();
    }
}
