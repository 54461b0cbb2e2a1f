package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.model.MintReceipt;
import com.synthetic.solvency.domain.model.Position;
import com.synthetic.solvency.domain.model.PriceQuote;
import com.synthetic.solvency.domain.model.SolvencyEventType;
import com.synthetic.solvency.domain.port.SolvencyEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MintingEngine {

    private final SolvencyState state;
    private final PositionLedger positionLedger;
    private final PriceOracleFeed priceOracleFeed;
    private final SolvencyEventPublisher eventPublisher;

    public Position deposit(String account, long amount, long now) {
        Position updated = state.write("deposit", () -> {
            Position deposited = positionLedger.applyDeposit(account, amount, now);
            eventPublisher.positionChanged(SolvencyEventType.DEPOSIT, deposited, amount, now);
            return deposited;
        });

        log.info("[Mint] 담보 예치: account={}, amount={}, collateral={}, block={}",
                account, amount, updated.getCollateralDeposited(), now);
        return updated;
    }

    /**
     * @return amount credited to the caller, i.e. the gross amount less the minting fee
     */
    public long mint(String account, long amount, long now) {
        MintReceipt receipt = state.write("mint", () -> {
            PriceQuote quote = priceOracleFeed.currentQuote();
            MintReceipt minted = positionLedger.applyMint(account, amount, quote, now);
            eventPublisher.positionChanged(SolvencyEventType.MINT, minted.position(), amount, now);
            return minted;
        });

        Position position = receipt.position();
        log.info("[Mint] 합성자산 발행: account={}, gross={}, fee={}, net={}, debt={}, health={}, block={}",
                account, receipt.grossAmount(), receipt.fee(), receipt.mintedAfterFee(),
                position.getSyntheticMinted(), position.getPositionHealth().wireValue(), now);
        return receipt.mintedAfterFee();
    }

    public long maxAdditionalMintable(String account) {
        return state.read(() -> positionLedger.maxMintable(account, priceOracleFeed.currentQuote()));
    }
}
