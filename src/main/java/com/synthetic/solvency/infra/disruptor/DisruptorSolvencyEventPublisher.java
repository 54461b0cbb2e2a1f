package com.synthetic.solvency.infra.disruptor;

import com.lmax.disruptor.RingBuffer;
import com.synthetic.solvency.domain.model.LiquidationRecord;
import com.synthetic.solvency.domain.model.Position;
import com.synthetic.solvency.domain.model.PositionSnapshot;
import com.synthetic.solvency.domain.model.PriceSubmission;
import com.synthetic.solvency.domain.model.SolvencyEventType;
import com.synthetic.solvency.domain.port.SolvencyEventPublisher;
import com.synthetic.solvency.infra.disruptor.event.SolvencyEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

@Slf4j
@Component
@RequiredArgsConstructor
public class DisruptorSolvencyEventPublisher implements SolvencyEventPublisher {

    private final RingBuffer<SolvencyEvent> solvencyEventRingBuffer;

    @Override
    public void positionChanged(SolvencyEventType type, Position position, long amount, long block) {
        PositionSnapshot snapshot = PositionSnapshot.from(position);
        publish(type, block, event -> {
            event.setPosition(snapshot);
            event.setSubject(snapshot.account());
            event.setAmount(amount);
        });
    }

    @Override
    public void priceSubmitted(PriceSubmission submission) {
        publish(SolvencyEventType.PRICE_SUBMITTED, submission.timestamp(), event -> {
            event.setSubmission(submission);
            event.setActor(submission.oracle());
            event.setSubject(submission.assetId());
            event.setAmount(submission.price());
        });
    }

    @Override
    public void liquidated(LiquidationRecord record, Position position) {
        PositionSnapshot snapshot = PositionSnapshot.from(position);
        publish(SolvencyEventType.LIQUIDATION, record.getBlockHeight(), event -> {
            event.setLiquidation(record);
            event.setPosition(snapshot);
            event.setActor(record.getLiquidator());
            event.setSubject(record.getAccount());
            event.setAmount(record.getDebtCovered());
        });
    }

    @Override
    public void administrative(SolvencyEventType type, String actor, String subject, long block) {
        publish(type, block, event -> {
            event.setActor(actor);
            event.setSubject(subject);
        });
    }

    private void publish(SolvencyEventType type, long block, Consumer<SolvencyEvent> filler) {
        boolean published = solvencyEventRingBuffer.tryPublishEvent((event, seq) -> {
            event.clear();
            event.setType(type);
            event.setBlock(block);
            event.setPublishNanoTime(System.nanoTime());
            filler.accept(event);
        });
        if (!published) {
            log.warn("[Publisher] 링버퍼 가득 참, 이벤트 드롭: type={}, block={}", type, block);
        }
    }
}
