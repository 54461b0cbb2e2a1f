package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import com.synthetic.solvency.domain.model.Health;
import com.synthetic.solvency.domain.model.MintReceipt;
import com.synthetic.solvency.domain.model.Position;
import com.synthetic.solvency.domain.model.PriceQuote;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owner of every position. Positions are immutable values, so whatever a
 * caller receives is already a copy. The {@code apply*} methods and
 * {@link #commit} must run inside {@link SolvencyState#write}.
 */
@Service
@RequiredArgsConstructor
public class PositionLedger {

    private final SolvencyState state;
    private final PriceOracleFeed priceOracleFeed;
    private final SolvencyProperties properties;

    private final Map<String, Position> positions = new HashMap<>();

    public Optional<Position> get(String account) {
        return state.read(() -> Optional.ofNullable(positions.get(account)));
    }

    public Position openOrGet(String account) {
        return state.read(() -> positions.getOrDefault(account, Position.empty(account)));
    }

    public Collection<Position> all() {
        return state.read(() -> List.copyOf(positions.values()));
    }

    public Position applyDeposit(String account, long amount, long now) {
        state.requireWriteTransaction();
        state.requireNotPaused();
        if (amount <= 0) {
            throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT, "deposit amount must be positive");
        }

        Position current = openOrGet(account);
        long newCollateral = FixedPointMath.add(current.getCollateralDeposited(), amount);
        long newTotalCollateral = FixedPointMath.add(state.getTotalCollateral(), amount);

        Position updated = current.toBuilder()
                .collateralDeposited(newCollateral)
                .lastInteractionBlock(now)
                .build();
        commit(updated, newTotalCollateral, state.getTotalSyntheticSupply());
        return updated;
    }

    public MintReceipt applyMint(String account, long amount, PriceQuote quote, long now) {
        state.requireWriteTransaction();
        Position current = positions.get(account);
        if (current == null) {
            throw new SolvencyException(SolvencyErrorCode.POSITION_NOT_FOUND, "no position for " + account);
        }
        state.requireNotPaused();
        if (amount <= 0) {
            throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT, "mint amount must be positive");
        }
        priceOracleFeed.requireFresh(quote, now);

        long newMinted = FixedPointMath.add(current.getSyntheticMinted(), amount);
        long maxMintable = FixedPointMath.maxMintable(
                current.getCollateralDeposited(), quote.price(), properties.getMinCollateralRatio());
        if (newMinted > maxMintable) {
            throw new SolvencyException(SolvencyErrorCode.INSUFFICIENT_COLLATERAL,
                    "minted " + newMinted + " would exceed max mintable " + maxMintable);
        }
        if (FixedPointMath.sub(now, current.getLastInteractionBlock()) < properties.getCooldownBlocks()) {
            throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT,
                    "cooldown active until block "
                            + (current.getLastInteractionBlock() + properties.getCooldownBlocks()));
        }

        Health health = FixedPointMath.positionHealth(current.getCollateralDeposited(), newMinted, quote.price());
        long newSupply = FixedPointMath.add(state.getTotalSyntheticSupply(), amount);
        long fee = FixedPointMath.bpsOf(amount, properties.getMintingFeeBps());
        long mintedAfterFee = FixedPointMath.sub(amount, fee);

        Position updated = current.toBuilder()
                .syntheticMinted(newMinted)
                .positionHealth(health)
                .lastInteractionBlock(now)
                .build();
        commit(updated, state.getTotalCollateral(), newSupply);
        return new MintReceipt(amount, fee, mintedAfterFee, updated);
    }

    public long maxMintable(String account, PriceQuote quote) {
        Position position = openOrGet(account);
        long capacity = FixedPointMath.maxMintable(
                position.getCollateralDeposited(), quote.price(), properties.getMinCollateralRatio());
        return capacity > position.getSyntheticMinted() ? capacity - position.getSyntheticMinted() : 0L;
    }

    /**
     * Replaces a position and the global totals in one step. Callers have
     * already validated and computed every value.
     */
    void commit(Position position, long newTotalCollateral, long newTotalSyntheticSupply) {
        state.requireWriteTransaction();
        if (position.getCollateralDeposited() < 0 || position.getSyntheticMinted() < 0) {
            throw new IllegalStateException("position balances must not be negative: " + position);
        }
        if (!position.hasDebt() && !position.getPositionHealth().isUnbounded()) {
            throw new IllegalStateException("debt-free position must have unbounded health: " + position);
        }
        state.commitTotals(newTotalCollateral, newTotalSyntheticSupply);
        positions.put(position.getAccount(), position);
    }
}
