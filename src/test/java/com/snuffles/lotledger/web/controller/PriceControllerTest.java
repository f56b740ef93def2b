package com.snuffles.lotledger.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.lotledger.service.ClosingPriceService;
import com.snuffles.lotledger.web.dto.ClosingPriceDto;
import com.snuffles.lotledger.web.dto.ClosingPriceRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PriceController.class)
class PriceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ClosingPriceService closingPriceService;

    @Test
    void recordCloseStoresPrice() throws Exception {
        ClosingPriceDto stored = new ClosingPriceDto();
        stored.setSymbol("ABC");
        stored.setClosePrice(new BigDecimal("55.5"));
        given(closingPriceService.recordClose(eq("abc"), eq(LocalDate.of(2023, 3, 30)), any(ClosingPriceRequest.class))).willReturn(stored);

        mockMvc.perform(put("/api/prices/abc/2023-03-30")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new ClosingPriceRequest(new BigDecimal("55.5"), "manual"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.symbol", is("ABC")))
            .andExpect(jsonPath("$.closePrice", is(55.5)));
    }

    @Test
    void recordCloseRejectsMissingPrice() throws Exception {
        mockMvc.perform(put("/api/prices/abc/2023-03-30")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"manual\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(closingPriceService);
    }
}
