package com.flagship.treasury_ledger.treasury;

import com.flagship.treasury_ledger.ledger.AccountService;
import com.flagship.treasury_ledger.ledger.LogicalAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class TreasuryStatusService {

    static final int PERCENTAGE_SCALE = 4;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final AccountService accountService;
    private final String reserveAccountName;
    private final BigDecimal minimumReservePercentage;
    private final String mode;

    public TreasuryStatusService(AccountService accountService,
                                 @Value("${treasury.reserve.account-name:reserve}") String reserveAccountName,
                                 @Value("${treasury.reserve.minimum-percentage:18}") BigDecimal minimumReservePercentage,
                                 @Value("${treasury.mode:demo}") String mode) {
        this.accountService = accountService;
        this.reserveAccountName = reserveAccountName;
        this.minimumReservePercentage = minimumReservePercentage;
        this.mode = mode;
    }

    /**
     * Active accounts, their total and reserve health, read in one
     * transaction so the figures agree with each other.
     */
    @Transactional(readOnly = true)
    public TreasuryStatus currentStatus() {
        List<LogicalAccount> accounts = accountService.listAccounts(false);
        BigDecimal total = accounts.stream()
                .map(LogicalAccount::getBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        ReserveStatus reserve = reserveStatus(accounts, total);
        if (!reserve.isHealthy()) {
            log.warn("Reserve {} at {}% of treasury, below minimum {}%",
                    reserveAccountName, reserve.getActualPercentage().toPlainString(),
                    minimumReservePercentage.toPlainString());
        }
        return new TreasuryStatus(accounts, total, reserve, mode, Instant.now());
    }

    ReserveStatus reserveStatus(List<LogicalAccount> accounts, BigDecimal total) {
        Optional<LogicalAccount> reserveAccount = accounts.stream()
                .filter(a -> reserveAccountName.equals(a.getName()))
                .findFirst();

        if (reserveAccount.isEmpty() || total.signum() == 0) {
            BigDecimal balance = reserveAccount.map(LogicalAccount::getBalance).orElse(BigDecimal.ZERO);
            return new ReserveStatus(reserveAccountName, balance, BigDecimal.ZERO.setScale(PERCENTAGE_SCALE),
                    minimumReservePercentage, true);
        }

        BigDecimal balance = reserveAccount.get().getBalance();
        BigDecimal actual = balance.multiply(HUNDRED).divide(total, PERCENTAGE_SCALE, RoundingMode.HALF_UP);
        return new ReserveStatus(reserveAccountName, balance, actual, minimumReservePercentage,
                actual.compareTo(minimumReservePercentage) >= 0);
    }
}
