package com.phillippitts.slotwatch.presentation.controller;

import com.phillippitts.slotwatch.config.properties.SubscriberProperties;
import com.phillippitts.slotwatch.exception.SubscriptionNotAllowedException;
import com.phillippitts.slotwatch.service.subscriber.InMemorySubscriberStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SubscriberControllerTest {

    private InMemorySubscriberStore store;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        store = new InMemorySubscriberStore();
        mvc = mvcAllowing(List.of());
    }

    private MockMvc mvcAllowing(List<Long> allowedIds) {
        SubscriberProperties props = new SubscriberProperties(SubscriberProperties.Backend.MEMORY, null, allowedIds);
        return MockMvcBuilders.standaloneSetup(new SubscriberController(store, props)).build();
    }

    @Test
    void subscribeIsIdempotent() throws Exception {
        mvc.perform(post("/api/subscribers/1001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(1001))
                .andExpect(jsonPath("$.changed").value(true))
                .andExpect(jsonPath("$.message").value("Subscribed to availability alerts"));

        mvc.perform(post("/api/subscribers/1001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(false))
                .andExpect(jsonPath("$.message").value("Already subscribed"));

        assertThat(store.all()).containsExactly(1001L);
    }

    @Test
    void unsubscribeReportsWhetherIdWasPresent() throws Exception {
        store.add(7L);

        mvc.perform(delete("/api/subscribers/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true))
                .andExpect(jsonPath("$.message").value("Unsubscribed"));

        mvc.perform(delete("/api/subscribers/7"))
                .andExpect(jsonPath("$.changed").value(false))
                .andExpect(jsonPath("$.message").value("Was not subscribed"));
    }

    @Test
    void countReflectsStore() throws Exception {
        store.add(1L);
        store.add(2L);

        mvc.perform(get("/api/subscribers/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscribers").value(2));
    }

    @Test
    void nonNumericIdIsBadRequest() throws Exception {
        mvc.perform(post("/api/subscribers/abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void allowlistedIdCanSubscribe() throws Exception {
        MockMvc restricted = mvcAllowing(List.of(1001L, 1002L));

        restricted.perform(post("/api/subscribers/1002"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true));

        assertThat(store.all()).containsExactly(1002L);
    }

    @Test
    void idOutsideAllowlistIsRejectedAndNotStored() {
        MockMvc restricted = mvcAllowing(List.of(1001L));

        assertThatThrownBy(() -> restricted.perform(post("/api/subscribers/666")))
                .hasRootCauseInstanceOf(SubscriptionNotAllowedException.class);

        assertThat(store.count()).isZero();
    }

    @Test
    void unsubscribeIsNotGatedByAllowlist() throws Exception {
        store.add(666L);
        MockMvc restricted = mvcAllowing(List.of(1001L));

        restricted.perform(delete("/api/subscribers/666"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true));
    }
}
