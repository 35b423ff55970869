package com.flagship.bounty_ledger.outbox;

import com.flagship.bounty_ledger.IntegrationTestSupport;
import com.flagship.bounty_ledger.task.Task;
import com.flagship.bounty_ledger.task.event.TaskCreatedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutboxServiceTest extends IntegrationTestSupport {

    @Autowired
    private OutboxService outboxService;

    @Test
    @DisplayName("State change and its event commit together")
    void saveEvent_WithStateChange_Stored() {
        Task task = fixtures.task("0.5", 1);

        List<OutboxEvent> events = outboxService.getEventsForAggregate(task.getId());

        assertEquals(1, events.size());
        OutboxEvent event = events.get(0);
        assertEquals(TaskCreatedEvent.EVENT_TYPE, event.getEventType());
        assertEquals(TaskCreatedEvent.AGGREGATE_TYPE, event.getAggregateType());
        assertFalse(event.isPublished());
        assertTrue(event.getPayload().contains(task.getId().toString()));
    }

    @Test
    @DisplayName("Saving an event outside a transaction is refused")
    void saveEvent_WithoutTransaction_Refused() {
        Task task = fixtures.task("0.5", 1);

        assertThrows(IllegalTransactionStateException.class,
                () -> outboxService.saveEvent(TaskCreatedEvent.fromTask(task)));
    }

    @Test
    @DisplayName("Published events leave the unpublished queue; failures count retries")
    void markPublishedAndFailed_UpdateEvent() {
        Task first = fixtures.task("0.5", 1);
        Task second = fixtures.task("0.5", 1);
        OutboxEvent published = outboxService.getEventsForAggregate(first.getId()).get(0);
        OutboxEvent failing = outboxService.getEventsForAggregate(second.getId()).get(0);
        long unpublishedBefore = outboxService.countUnpublished();

        outboxService.markPublished(published.getId());
        outboxService.markFailed(failing.getId(), "broker unavailable");
        outboxService.markFailed(failing.getId(), "broker unavailable");

        assertTrue(outboxService.getEventsForAggregate(first.getId()).get(0).isPublished());
        OutboxEvent failed = outboxService.getEventsForAggregate(second.getId()).get(0);
        assertFalse(failed.isPublished());
        assertEquals(2, failed.getRetryCount());
        assertEquals("broker unavailable", failed.getLastError());
        assertEquals(unpublishedBefore - 1, outboxService.countUnpublished());
    }
}
