package com.snuffles.lotledger.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.lotledger.service.ValuationService;
import com.snuffles.lotledger.service.exception.PriceNotFoundException;
import com.snuffles.lotledger.web.dto.DailyPnlSnapshotDto;
import com.snuffles.lotledger.web.dto.ValuationRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ValuationController.class)
class ValuationControllerTest {

    private static final LocalDate DATE = LocalDate.of(2023, 3, 31);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ValuationService valuationService;

    @Test
    void snapshotWithExplicitPrice() throws Exception {
        DailyPnlSnapshotDto snapshot = new DailyPnlSnapshotDto();
        snapshot.setSymbol("ABC");
        snapshot.setStalePrice(true);
        given(valuationService.snapshot("acct", "ABC", DATE, new BigDecimal("130"), DATE.minusDays(1))).willReturn(snapshot);

        ValuationRequest request = ValuationRequest.builder()
            .symbol("ABC")
            .valuationDate(DATE)
            .marketPrice(new BigDecimal("130"))
            .priceDate(DATE.minusDays(1))
            .build();

        mockMvc.perform(post("/api/accounts/acct/valuations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.symbol", is("ABC")))
            .andExpect(jsonPath("$.stalePrice", is(true)));
    }

    @Test
    void snapshotRequiresPositivePrice() throws Exception {
        ValuationRequest request = ValuationRequest.builder().symbol("ABC").valuationDate(DATE).marketPrice(BigDecimal.ZERO).build();

        mockMvc.perform(post("/api/accounts/acct/valuations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest());
    }

    @Test
    void feedSnapshotForOneSymbolOrWholeAccount() throws Exception {
        given(valuationService.snapshotFromFeed("acct", "ABC", DATE)).willReturn(new DailyPnlSnapshotDto());
        given(valuationService.snapshotAccount("acct", DATE)).willReturn(List.of(new DailyPnlSnapshotDto(), new DailyPnlSnapshotDto()));

        mockMvc.perform(post("/api/accounts/acct/valuations/2023-03-31").param("symbol", "ABC"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)));
        mockMvc.perform(post("/api/accounts/acct/valuations/2023-03-31"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)));

        verify(valuationService).snapshotAccount("acct", DATE);
    }

    @Test
    void feedSnapshotWithoutPriceIsNotFound() throws Exception {
        given(valuationService.snapshotFromFeed("acct", "ABC", DATE)).willThrow(new PriceNotFoundException("No price for ABC"));

        mockMvc.perform(post("/api/accounts/acct/valuations/2023-03-31").param("symbol", "ABC"))
            .andExpect(status().isNotFound());
    }

    @Test
    void badDateInPathIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/accounts/acct/valuations/31-03-2023"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void listSnapshots() throws Exception {
        given(valuationService.getSnapshots("acct", null, DATE, null)).willReturn(List.of(new DailyPnlSnapshotDto()));

        mockMvc.perform(get("/api/accounts/acct/valuations").param("from", "2023-03-31"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void backfillDefaultsToTradingDaysOnly() throws Exception {
        LocalDate from = LocalDate.of(2023, 3, 1);
        given(valuationService.snapshotRange("acct", from, DATE, true)).willReturn(List.of(new DailyPnlSnapshotDto()));

        mockMvc.perform(post("/api/accounts/acct/valuations/backfill").param("from", "2023-03-01").param("to", "2023-03-31"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)));

        verify(valuationService).snapshotRange("acct", from, DATE, true);
    }

    @Test
    void backfillWithoutRangeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/accounts/acct/valuations/backfill").param("from", "2023-03-01"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details[0]", is("to: is required")));
    }
}
