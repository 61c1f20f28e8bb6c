package org.example.assessment.service;

import org.example.assessment.entity.PointsAccountEntity;
import org.example.assessment.entity.PointsAllowanceEntity;
import org.example.assessment.model.HolderBalance;
import org.example.assessment.model.PointsTokenInfo;
import org.example.assessment.repository.PointsAccountRepository;
import org.example.assessment.repository.PointsAllowanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;

@Service
public class PointsLedgerService implements PointsLedger {

    private static final Logger log = LoggerFactory.getLogger(PointsLedgerService.class);

    private final PointsAccountRepository accountRepository;
    private final PointsAllowanceRepository allowanceRepository;
    private final AuditEventService auditEventService;
    private final LedgerSequencer sequencer;
    private final String minter;

    public PointsLedgerService(
            PointsAccountRepository accountRepository,
            PointsAllowanceRepository allowanceRepository,
            AuditEventService auditEventService,
            LedgerSequencer sequencer,
            @Value("${rewards.issuer-identity:assessment-manager}") String minter) {
        this.accountRepository = accountRepository;
        this.allowanceRepository = allowanceRepository;
        this.auditEventService = auditEventService;
        this.sequencer = sequencer;
        this.minter = Identities.require(minter);
    }

    @Override
    public void credit(String caller, String holder, BigInteger amount) {
        sequencer.run(() -> {
            if (!minter.equals(Identities.normalize(caller))) {
                throw new AssessmentException(AssessmentError.NOT_OWNER, "Ownable: caller is not the owner");
            }
            String holderId = Identities.require(holder);
            requireAmount(amount);
            if (amount.signum() == 0) {
                log.debug("Zero credit to {} ignored", holderId);
                return;
            }
            BigInteger supply = accountRepository.sumBalances();
            if (supply != null && supply.add(amount).compareTo(MAX_AMOUNT) > 0) {
                throw new AssessmentException(AssessmentError.INVALID_REWARD_AMOUNT, "Credit would overflow total supply");
            }

            PointsAccountEntity account = accountRepository.findById(holderId).orElse(null);
            if (account == null) {
                account = new PointsAccountEntity(holderId, accountRepository.count());
                auditEventService.record("HolderAdded", minter, AuditEventService.fields("holder", holderId));
            }
            account.setBalance(account.getBalance().add(amount));
            accountRepository.save(account);
            log.info("Credited {} points to {}", amount, holderId);
            auditEventService.record("PointsCredited", minter, AuditEventService.fields(
                    "holder", holderId,
                    "amount", amount.toString(),
                    "balance", account.getBalance().toString()));
        });
    }

    @Override
    public void transfer(String from, String to, BigInteger amount) {
        log.debug("Rejected transfer from {} to {}", from, to);
        throw new AssessmentException(AssessmentError.POINTS_NON_TRANSFERABLE);
    }

    @Override
    public void transferFrom(String spender, String from, String to, BigInteger amount) {
        log.debug("Rejected transferFrom by {} from {} to {}", spender, from, to);
        throw new AssessmentException(AssessmentError.POINTS_NON_TRANSFERABLE);
    }

    @Override
    public void approve(String owner, String spender, BigInteger amount) {
        sequencer.run(() -> {
            String ownerId = Identities.require(owner);
            String spenderId = Identities.require(spender);
            requireAmount(amount);
            PointsAllowanceEntity allowance = allowanceRepository.findByOwnerIdAndSpenderId(ownerId, spenderId)
                    .orElseGet(() -> new PointsAllowanceEntity(ownerId, spenderId));
            allowance.setAmount(amount);
            allowanceRepository.save(allowance);
            auditEventService.record("Approval", ownerId, AuditEventService.fields(
                    "spender", spenderId,
                    "amount", amount.toString()));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger allowance(String owner, String spender) {
        String ownerId = Identities.normalize(owner);
        String spenderId = Identities.normalize(spender);
        if (ownerId == null || spenderId == null) {
            return BigInteger.ZERO;
        }
        return allowanceRepository.findByOwnerIdAndSpenderId(ownerId, spenderId)
                .map(PointsAllowanceEntity::getAmount)
                .orElse(BigInteger.ZERO);
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String holder) {
        String holderId = Identities.normalize(holder);
        if (holderId == null) {
            return BigInteger.ZERO;
        }
        return accountRepository.findById(holderId)
                .map(PointsAccountEntity::getBalance)
                .orElse(BigInteger.ZERO);
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger totalSupply() {
        BigInteger total = accountRepository.sumBalances();
        return total == null ? BigInteger.ZERO : total;
    }

    @Override
    @Transactional(readOnly = true)
    public long holderCount() {
        return accountRepository.count();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isHolder(String identity) {
        String holderId = Identities.normalize(identity);
        return holderId != null && accountRepository.existsById(holderId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<HolderBalance> getHolders(int offset, int limit) {
        if (offset < 0 || limit <= 0) {
            return List.of();
        }
        List<PointsAccountEntity> accounts = accountRepository.findAllByOrderByHolderIndexAsc();
        if (offset >= accounts.size()) {
            return List.of();
        }
        int end = (int) Math.min((long) offset + limit, accounts.size());
        return accounts.subList(offset, end).stream()
                .map(this::toHolderBalance)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<HolderBalance> getTopHolders(int count) {
        if (count <= 0) {
            return List.of();
        }
        return accountRepository.findTopHolders(PageRequest.of(0, count)).stream()
                .map(this::toHolderBalance)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public PointsTokenInfo tokenInfo() {
        return new PointsTokenInfo(NAME, SYMBOL, DECIMALS, totalSupply().toString(), holderCount(), minter);
    }

    private void requireAmount(BigInteger amount) {
        if (amount == null || amount.signum() < 0 || amount.compareTo(MAX_AMOUNT) > 0) {
            throw new AssessmentException(AssessmentError.INVALID_REWARD_AMOUNT);
        }
    }

    private HolderBalance toHolderBalance(PointsAccountEntity account) {
        return new HolderBalance(account.getHolderId(), account.getBalance().toString());
    }
}
