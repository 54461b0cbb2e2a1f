package com.synthetic.solvency.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.synthetic.solvency.domain.model.LiquidationRecord;
import com.synthetic.solvency.domain.model.PositionSnapshot;
import com.synthetic.solvency.domain.model.PriceSubmission;
import com.synthetic.solvency.infra.disruptor.event.SolvencyEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SolvencyBroadcastHandler implements EventHandler<SolvencyEvent> {

    static final String PRICE_TOPIC = "/topic/price";
    static final String POSITION_TOPIC = "/topic/position/";
    static final String LIQUIDATION_TOPIC = "/topic/liquidation";
    static final String ADMIN_TOPIC = "/topic/admin";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onEvent(SolvencyEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) return;

        PriceSubmission submission = event.getSubmission();
        if (submission != null) {
            messagingTemplate.convertAndSend(PRICE_TOPIC, submission);
            log.debug("[Broadcast] Price → {}, asset={}, price={}, oracle={}",
                    PRICE_TOPIC, submission.assetId(), submission.price(), submission.oracle());
        }

        LiquidationRecord record = event.getLiquidation();
        if (record != null) {
            messagingTemplate.convertAndSend(LIQUIDATION_TOPIC, record);
            log.debug("[Broadcast] Liquidation → {}, id={}, account={}",
                    LIQUIDATION_TOPIC, record.getLiquidationId(), record.getAccount());
        }

        PositionSnapshot position = event.getPosition();
        if (position != null && event.getType().carriesPosition()) {
            String destination = POSITION_TOPIC + position.account();
            messagingTemplate.convertAndSend(destination, position);
            log.debug("[Broadcast] {} → {}, health={}, latency={}μs",
                    event.getType(), destination, position.positionHealth(),
                    (System.nanoTime() - event.getPublishNanoTime()) / 1_000);
        }

        if (event.getType().isAdministrative()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("type", event.getType().name());
            payload.put("actor", event.getActor());
            payload.put("subject", event.getSubject());
            payload.put("block", event.getBlock());
            messagingTemplate.convertAndSend(ADMIN_TOPIC, payload);
            log.debug("[Broadcast] Admin → {}, type={}, actor={}", ADMIN_TOPIC, event.getType(), event.getActor());
        }
    }
}
