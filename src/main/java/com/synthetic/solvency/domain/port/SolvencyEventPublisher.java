package com.synthetic.solvency.domain.port;

import com.synthetic.solvency.domain.model.LiquidationRecord;
import com.synthetic.solvency.domain.model.Position;
import com.synthetic.solvency.domain.model.PriceSubmission;
import com.synthetic.solvency.domain.model.SolvencyEventType;

/**
 * Outbound notifications of committed state changes. Called after commit
 * while the write transaction is still held, so events leave in commit order.
 * Implementations must not block or call back into the engine.
 */
public interface SolvencyEventPublisher {

    void positionChanged(SolvencyEventType type, Position position, long amount, long block);

    void priceSubmitted(PriceSubmission submission);

    void liquidated(LiquidationRecord record, Position position);

    void administrative(SolvencyEventType type, String actor, String subject, long block);
}
