package org.example.assessment.service;

import org.example.assessment.model.HolderBalance;
import org.example.assessment.model.PointsTokenInfo;

import java.math.BigInteger;
import java.util.List;

/**
 * Non-transferable balance ledger. Only the minter may credit; peer transfers always fail.
 */
public interface PointsLedger {

    String NAME = "Puzzle Points";
    String SYMBOL = "PP";
    int DECIMALS = 18;

    /**
     * Upper bound for any balance, allowance, total supply or configured reward (2^256 - 1).
     */
    BigInteger MAX_AMOUNT = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /**
     * Credit {@code amount} to {@code holder}. A zero amount is accepted and changes nothing.
     *
     * @param caller must be the ledger's minter
     */
    void credit(String caller, String holder, BigInteger amount);

    void transfer(String from, String to, BigInteger amount);

    void transferFrom(String spender, String from, String to, BigInteger amount);

    void approve(String owner, String spender, BigInteger amount);

    BigInteger allowance(String owner, String spender);

    BigInteger balanceOf(String holder);

    BigInteger totalSupply();

    long holderCount();

    boolean isHolder(String identity);

    /**
     * Holders in first-credit order. Empty when {@code offset} is past the end.
     */
    List<HolderBalance> getHolders(int offset, int limit);

    /**
     * Largest balances first, at most {@code count} entries.
     */
    List<HolderBalance> getTopHolders(int count);

    PointsTokenInfo tokenInfo();
}
