package org.example.assessment.controller;

import org.example.assessment.config.CallerIdentity;
import org.example.assessment.model.HolderBalance;
import org.example.assessment.model.PointsTokenInfo;
import org.example.assessment.model.RewardConfig;
import org.example.assessment.service.PointsLedger;
import org.example.assessment.service.RewardIssuerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

@RestController
@RequestMapping("/api/rewards")
public class RewardController {

    private static final int MAX_PAGE_SIZE = 200;

    private final RewardIssuerService rewardIssuer;
    private final PointsLedger pointsLedger;

    public RewardController(RewardIssuerService rewardIssuer, PointsLedger pointsLedger) {
        this.rewardIssuer = rewardIssuer;
        this.pointsLedger = pointsLedger;
    }

    @GetMapping("/config")
    public RewardConfig getConfig() {
        return rewardIssuer.getRewardConfig();
    }

    @PutMapping("/config/threshold")
    public RewardConfig setThreshold(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody ThresholdRequest request) {
        return rewardIssuer.setPassingScoreThreshold(caller, request.threshold());
    }

    @PutMapping("/config/max-reward")
    public RewardConfig setMaxReward(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody MaxRewardRequest request) {
        return rewardIssuer.setMaxRewardUnits(caller, parseAmount(request.maxRewardUnits()));
    }

    @GetMapping("/token")
    public PointsTokenInfo token() {
        return pointsLedger.tokenInfo();
    }

    @GetMapping("/balances/{holder}")
    public BalanceResponse balance(@PathVariable String holder) {
        return new BalanceResponse(
                holder,
                pointsLedger.balanceOf(holder).toString(),
                pointsLedger.isHolder(holder));
    }

    @GetMapping("/holders")
    public List<HolderBalance> holders(
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "50") int limit) {
        return pointsLedger.getHolders(offset, Math.min(limit, MAX_PAGE_SIZE));
    }

    @GetMapping("/leaderboard")
    public List<HolderBalance> leaderboard(@RequestParam(defaultValue = "10") int count) {
        return pointsLedger.getTopHolders(Math.min(count, MAX_PAGE_SIZE));
    }

    @GetMapping("/allowances")
    public AllowanceResponse allowance(@RequestParam String owner, @RequestParam String spender) {
        return new AllowanceResponse(owner, spender, pointsLedger.allowance(owner, spender).toString());
    }

    @PostMapping("/approve")
    public AllowanceResponse approve(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody ApproveRequest request) {
        BigInteger amount = parseAmount(request.amount());
        pointsLedger.approve(caller, request.spender(), amount);
        return new AllowanceResponse(caller, request.spender(), amount.toString());
    }

    @PostMapping("/transfer")
    public void transfer(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody TransferRequest request) {
        pointsLedger.transfer(caller, request.to(), parseAmount(request.amount()));
    }

    @PostMapping("/transfer-from")
    public void transferFrom(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody TransferFromRequest request) {
        pointsLedger.transferFrom(caller, request.from(), request.to(), parseAmount(request.amount()));
    }

    private BigInteger parseAmount(String amount) {
        if (amount == null || amount.isBlank()) {
            throw new IllegalArgumentException("amount is required");
        }
        return new BigInteger(amount.trim());
    }

    public record ThresholdRequest(int threshold) {
    }

    public record MaxRewardRequest(String maxRewardUnits) {
    }

    public record ApproveRequest(String spender, String amount) {
    }

    public record TransferRequest(String to, String amount) {
    }

    public record TransferFromRequest(String from, String to, String amount) {
    }

    public record BalanceResponse(String holder, String balance, boolean holderOfRecord) {
    }

    public record AllowanceResponse(String owner, String spender, String amount) {
    }
}
