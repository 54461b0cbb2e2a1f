package com.synthetic.solvency.infra.disruptor.event;

import com.synthetic.solvency.domain.model.LiquidationRecord;
import com.synthetic.solvency.domain.model.PositionSnapshot;
import com.synthetic.solvency.domain.model.PriceSubmission;
import com.synthetic.solvency.domain.model.SolvencyEventType;

public class SolvencyEvent {

    private SolvencyEventType type;
    private long block;
    private long amount;
    private String actor;
    private String subject;
    private long publishNanoTime;

    private PositionSnapshot position;
    private PriceSubmission submission;
    private LiquidationRecord liquidation;

    public void clear() {
        type = null;
        block = 0L;
        amount = 0L;
        actor = null;
        subject = null;
        publishNanoTime = 0L;
        position = null;
        submission = null;
        liquidation = null;
    }

    public SolvencyEventType getType() {
        return type;
    }

    public void setType(SolvencyEventType type) {
        this.type = type;
    }

    public long getBlock() {
        return block;
    }

    public void setBlock(long block) {
        this.block = block;
    }

    public long getAmount() {
        return amount;
    }

    public void setAmount(long amount) {
        this.amount = amount;
    }

    public String getActor() {
        return actor;
    }

    public void setActor(String actor) {
        this.actor = actor;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public long getPublishNanoTime() {
        return publishNanoTime;
    }

    public void setPublishNanoTime(long publishNanoTime) {
        this.publishNanoTime = publishNanoTime;
    }

    public PositionSnapshot getPosition() {
        return position;
    }

    public void setPosition(PositionSnapshot position) {
        this.position = position;
    }

    public PriceSubmission getSubmission() {
        return submission;
    }

    public void setSubmission(PriceSubmission submission) {
        this.submission = submission;
    }

    public LiquidationRecord getLiquidation() {
        return liquidation;
    }

    public void setLiquidation(LiquidationRecord liquidation) {
        this.liquidation = liquidation;
    }

    @Override
    public String toString() {
        return "SolvencyEvent{type=" + type + ", block=" + block
                + ", account=" + (position != null ? position.account() : subject) + "}";
    }
}
