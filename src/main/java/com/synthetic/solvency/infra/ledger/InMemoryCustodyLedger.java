package com.synthetic.solvency.infra.ledger;

import com.synthetic.solvency.domain.port.TransferGateway;
import com.synthetic.solvency.domain.service.SolvencyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Process-local stand-in for the value ledger. Custody starts with the
 * configured balance; every other identity starts at zero.
 */
@Slf4j
@Component
public class InMemoryCustodyLedger implements TransferGateway {

    private final String custodyIdentity;
    private final Map<String, Long> balances = new HashMap<>();

    public InMemoryCustodyLedger(SolvencyProperties properties) {
        this.custodyIdentity = properties.getCustody().getIdentity();
        this.balances.put(custodyIdentity, properties.getCustody().getInitialBalance());
    }

    @Override
    public synchronized boolean transfer(long amount, String from, String to) {
        if (amount < 0 || from == null || to == null) {
            log.warn("[Ledger] 잘못된 이체 요청: amount={}, from={}, to={}", amount, from, to);
            return false;
        }
        long fromBalance = balances.getOrDefault(from, 0L);
        if (fromBalance < amount) {
            log.warn("[Ledger] 잔액 부족: from={}, balance={}, amount={}", from, fromBalance, amount);
            return false;
        }
        long toBalance = balances.getOrDefault(to, 0L);
        if (!from.equals(to) && Long.MAX_VALUE - toBalance < amount) {
            log.warn("[Ledger] 수취 잔액 오버플로: to={}, balance={}, amount={}", to, toBalance, amount);
            return false;
        }
        balances.put(from, fromBalance - amount);
        balances.put(to, balances.getOrDefault(to, 0L) + amount);
        log.debug("[Ledger] 이체 완료: from={}, to={}, amount={}", from, to, amount);
        return true;
    }

    @Override
    public String custodyIdentity() {
        return custodyIdentity;
    }

    public synchronized long balanceOf(String identity) {
        return balances.getOrDefault(identity, 0L);
    }
}
