package com.raava.concierge.dialogue.machine;

import com.raava.concierge.dialogue.model.AcquisitionSlots;
import com.raava.concierge.dialogue.model.AcquisitionStage;
import com.raava.concierge.dialogue.model.ExpectationKind;
import com.raava.concierge.dialogue.model.MachineOutcome;
import com.raava.concierge.extraction.signal.ContactFact;
import com.raava.concierge.extraction.signal.FinancePreference;
import com.raava.concierge.extraction.signal.OptionChoice;
import com.raava.concierge.extraction.signal.PriceFact;
import com.raava.concierge.extraction.signal.VehicleFact;
import com.raava.concierge.finance.model.FinanceQuote;
import com.raava.concierge.finance.model.FinanceType;
import com.raava.concierge.finance.service.FinanceOfferService;
import com.raava.concierge.inventory.model.SearchCriteria;
import com.raava.concierge.inventory.model.VehicleListing;
import com.raava.concierge.inventory.service.VehicleSearchProvider;
import com.raava.concierge.session.model.ActiveDomain;
import com.raava.concierge.session.model.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AcquisitionMachineTest {

    @Mock
    private VehicleSearchProvider vehicleSearchProvider;

    @Mock
    private FinanceOfferService financeOfferService;

    @InjectMocks
    private AcquisitionMachine acquisitionMachine;

    private SessionState session;

    private final VehicleListing roma = listing("INV-2001", "Roma", 2022, 189_500.0);
    private final VehicleListing f8 = listing("INV-2002", "F8 Tributo", 2021, 239_000.0);
    private final VehicleListing sf90 = listing("INV-2003", "SF90 Stradale", 2023, 425_000.0);

    @BeforeEach
    void setUp() {
        session = new SessionState();
        session.setSessionId("session-1");
        session.activate(ActiveDomain.ACQUISITION, acquisitionMachine.initialSlots());
    }

    @Test
    void testAdvance_MakeRunsSearchAndOffersOptions() {
        // Given
        when(vehicleSearchProvider.search(any(SearchCriteria.class))).thenReturn(List.of(roma, f8, sf90));

        // When
        MachineOutcome outcome = acquisitionMachine.advance(session, List.of(new VehicleFact("Ferrari", null, null, null, null)));

        // Then
        assertEquals("VEHICLE_SELECTION", outcome.stage());
        assertEquals(List.of("Vehicle selection"), outcome.missingFields());
        assertEquals(List.of("VEHICLE_SELECTION"), outcome.enteredStages());
        assertFalse(outcome.ready());
        assertTrue(outcome.prompt().contains("1. 2022 Ferrari Roma - £189,500"));
        assertEquals(ExpectationKind.OPTION_CHOICE, session.getAwaiting().getKind());
        assertEquals(3, session.getAwaiting().getOptionCount());
    }

    @Test
    void testAdvance_FullPurchaseDefaultsToCash() {
        // Given
        when(vehicleSearchProvider.search(any(SearchCriteria.class))).thenReturn(List.of(roma, f8, sf90));

        // When
        acquisitionMachine.advance(session, List.of(new VehicleFact("Ferrari", null, null, null, null)));
        MachineOutcome picked = acquisitionMachine.advance(session, List.of(new OptionChoice(1)));
        MachineOutcome done = acquisitionMachine.advance(session,
                List.of(new ContactFact("John Smith", "john@x.com", "+447000000000", null)));

        // Then
        assertEquals("CUSTOMER_INFO", picked.stage());
        assertEquals(List.of("Full name", "Email address", "Phone number"), picked.missingFields());
        assertTrue(done.ready());
        assertEquals("READY", done.stage());
        AcquisitionSlots slots = (AcquisitionSlots) session.getSlots();
        assertEquals(roma, slots.getSelectedVehicle());
        assertEquals(FinanceType.CASH, slots.getFinanceType());
        assertNull(slots.getFinanceQuote());
        verify(vehicleSearchProvider, times(1)).search(any(SearchCriteria.class));
        verifyNoInteractions(financeOfferService);
    }

    @Test
    void testAdvance_SeveralStagesInOneTurn() {
        // Given
        when(vehicleSearchProvider.search(any(SearchCriteria.class))).thenReturn(List.of(roma, f8));
        acquisitionMachine.advance(session, List.of(
                new VehicleFact("Ferrari", null, null, null, null),
                new ContactFact("John Smith", "john@x.com", "+447000000000", null)));

        // When
        MachineOutcome outcome = acquisitionMachine.advance(session, List.of(new OptionChoice(2)));

        // Then
        assertTrue(outcome.ready());
        assertEquals(List.of("CUSTOMER_INFO", "READY"), outcome.enteredStages());
        assertEquals(f8, ((AcquisitionSlots) session.getSlots()).getSelectedVehicle());
    }

    @Test
    void testAdvance_FinancePreferenceIsQuotedAtReady() {
        // Given
        FinanceQuote quote = new FinanceQuote("Personal Contract Purchase", 3.9, 2_970.0, 144_820.0, 36, 37_900.0, 94_750.0, 12_000.0);
        when(vehicleSearchProvider.search(any(SearchCriteria.class))).thenReturn(List.of(roma));
        when(financeOfferService.quote(FinanceType.PCP, 189_500.0)).thenReturn(quote);

        // When
        acquisitionMachine.advance(session, List.of(
                new VehicleFact("Ferrari", null, null, null, null),
                new FinancePreference(FinanceType.PCP)));
        MachineOutcome outcome = acquisitionMachine.advance(session, List.of(
                new OptionChoice(1),
                new ContactFact("John Smith", "john@x.com", "07700900123", null)));

        // Then
        assertTrue(outcome.ready());
        assertEquals(quote, ((AcquisitionSlots) session.getSlots()).getFinanceQuote());
    }

    @Test
    void testAdvance_MonthlyBudgetBecomesPriceCeiling() {
        // Given
        when(financeOfferService.maxAffordablePrice(1_000, 0)).thenReturn(53_119.57);
        when(vehicleSearchProvider.search(any(SearchCriteria.class))).thenReturn(List.of());
        ArgumentCaptor<SearchCriteria> criteria = ArgumentCaptor.forClass(SearchCriteria.class);

        // When
        MachineOutcome outcome = acquisitionMachine.advance(session, List.of(
                new VehicleFact("Ferrari", null, null, null, null),
                new PriceFact(1_000, true)));

        // Then
        verify(vehicleSearchProvider).search(criteria.capture());
        assertEquals(53_119.57, criteria.getValue().getMaxPrice());
        assertEquals("VEHICLE_SELECTION", outcome.stage());
        assertTrue(outcome.prompt().startsWith("We have no Ferrari in stock right now under £53,120"));
    }

    @Test
    void testAdvance_ChangedMakeRefreshesResults() {
        // Given
        VehicleListing urus = VehicleListing.builder().id("INV-1001").make("Lamborghini").model("Urus")
                .year(2023).price(175_000.0).mileage(1_200).location("London").build();
        when(vehicleSearchProvider.search(any(SearchCriteria.class)))
                .thenReturn(List.of(roma, f8))
                .thenReturn(List.of(urus));
        acquisitionMachine.advance(session, List.of(new VehicleFact("Ferrari", null, null, null, null)));

        // When
        MachineOutcome outcome = acquisitionMachine.advance(session,
                List.of(new VehicleFact("Lamborghini", null, null, null, null)));

        // Then
        assertEquals(List.of(urus), ((AcquisitionSlots) session.getSlots()).getSearchResults());
        assertEquals(1, session.getAwaiting().getOptionCount());
        assertTrue(outcome.prompt().contains("1. 2023 Lamborghini Urus"));
        verify(vehicleSearchProvider, times(2)).search(any(SearchCriteria.class));
    }

    @Test
    void testAdvance_ModelNamePicksMatchingResult() {
        // Given
        when(vehicleSearchProvider.search(any(SearchCriteria.class))).thenReturn(List.of(roma, f8, sf90));
        acquisitionMachine.advance(session, List.of(new VehicleFact("Ferrari", null, null, null, null)));

        // When
        MachineOutcome outcome = acquisitionMachine.advance(session,
                List.of(new VehicleFact(null, "SF90 Stradale", null, null, null)));

        // Then
        assertEquals("CUSTOMER_INFO", outcome.stage());
        assertEquals(sf90, ((AcquisitionSlots) session.getSlots()).getSelectedVehicle());
    }

    @Test
    void testAdvance_OptionOutsideResultsIsIgnored() {
        // Given
        when(vehicleSearchProvider.search(any(SearchCriteria.class))).thenReturn(List.of(roma, f8, sf90));
        acquisitionMachine.advance(session, List.of(new VehicleFact("Ferrari", null, null, null, null)));

        // When
        MachineOutcome outcome = acquisitionMachine.advance(session, List.of(new OptionChoice(7)));

        // Then
        assertEquals("VEHICLE_SELECTION", outcome.stage());
        assertNull(((AcquisitionSlots) session.getSlots()).getSelectedVehicle());
    }

    @Test
    void testAdvance_NothingUsefulKeepsStageAndSlots() {
        // Given
        when(vehicleSearchProvider.search(any(SearchCriteria.class))).thenReturn(List.of(roma, f8, sf90));
        acquisitionMachine.advance(session, List.of(new VehicleFact("Ferrari", null, null, null, null)));
        acquisitionMachine.advance(session, List.of(new OptionChoice(1)));

        // When
        MachineOutcome outcome = acquisitionMachine.advance(session, List.of());

        // Then
        assertEquals("CUSTOMER_INFO", outcome.stage());
        assertTrue(outcome.enteredStages().isEmpty());
        AcquisitionSlots slots = (AcquisitionSlots) session.getSlots();
        assertEquals(AcquisitionStage.CUSTOMER_INFO, slots.getStage());
        assertEquals("Ferrari", slots.getMake());
        assertEquals(roma, slots.getSelectedVehicle());
        verify(financeOfferService, never()).quote(any(), anyDouble());
    }

    private static VehicleListing listing(String id, String model, int year, double price) {
        return VehicleListing.builder()
                .id(id).make("Ferrari").model(model).year(year).price(price)
                .mileage(3_400).location("London").source("Raava Exclusive")
                .build();
    }
}
