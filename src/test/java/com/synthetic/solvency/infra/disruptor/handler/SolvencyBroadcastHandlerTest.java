package com.synthetic.solvency.infra.disruptor.handler;

import com.synthetic.solvency.domain.model.LiquidationRecord;
import com.synthetic.solvency.domain.model.Position;
import com.synthetic.solvency.domain.model.PositionSnapshot;
import com.synthetic.solvency.domain.model.PriceSubmission;
import com.synthetic.solvency.domain.model.SolvencyEventType;
import com.synthetic.solvency.infra.disruptor.event.SolvencyEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

class SolvencyBroadcastHandlerTest {

    private SimpMessagingTemplate messagingTemplate;
    private SolvencyBroadcastHandler handler;

    @BeforeEach
    void setUp() {
        messagingTemplate = mock(SimpMessagingTemplate.class);
        handler = new SolvencyBroadcastHandler(messagingTemplate);
    }

    @Test
    void priceGoesToThePriceTopic() {
        PriceSubmission submission = new PriceSubmission("sUSD", 1, "oracle-1", 100_000_000L, 80, 5);
        SolvencyEvent event = new SolvencyEvent();
        event.setType(SolvencyEventType.PRICE_SUBMITTED);
        event.setSubmission(submission);

        handler.onEvent(event, 0, true);

        verify(messagingTemplate).convertAndSend("/topic/price", submission);
        verifyNoMoreInteractions(messagingTemplate);
    }

    @Test
    void liquidationGoesToLiquidationAndAccountTopics() {
        LiquidationRecord record = LiquidationRecord.builder().liquidationId(1).account("alice").build();
        PositionSnapshot snapshot = PositionSnapshot.from(Position.empty("alice"));
        SolvencyEvent event = new SolvencyEvent();
        event.setType(SolvencyEventType.LIQUIDATION);
        event.setLiquidation(record);
        event.setPosition(snapshot);

        handler.onEvent(event, 0, true);

        verify(messagingTemplate).convertAndSend("/topic/liquidation", record);
        verify(messagingTemplate).convertAndSend("/topic/position/alice", snapshot);
    }

    @Test
    @SuppressWarnings("unchecked")
    void administrativeEventsGoToTheAdminTopic() {
        SolvencyEvent event = new SolvencyEvent();
        event.setType(SolvencyEventType.PAUSED);
        event.setActor("protocol-admin");
        event.setSubject("pause");
        event.setBlock(12);

        handler.onEvent(event, 0, true);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/admin"), payload.capture());
        assertThat((Map<String, Object>) payload.getValue())
                .containsEntry("type", "PAUSED")
                .containsEntry("actor", "protocol-admin")
                .containsEntry("block", 12L);
    }

    @Test
    void untypedSlotIsIgnored() {
        handler.onEvent(new SolvencyEvent(), 0, true);

        verifyNoMoreInteractions(messagingTemplate);
    }
}
