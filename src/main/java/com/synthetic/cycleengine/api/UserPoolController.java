package com.synthetic.cycleengine.api;

import com.synthetic.cycleengine.api.dto.AccountAmountRequest;
import com.synthetic.cycleengine.api.dto.DepositRequest;
import com.synthetic.cycleengine.api.dto.LiquidationRequest;
import com.synthetic.cycleengine.api.dto.UserAccountView;
import com.synthetic.cycleengine.domain.external.ReserveToken;
import com.synthetic.cycleengine.domain.model.ClaimResult;
import com.synthetic.cycleengine.domain.model.HealthStatus;
import com.synthetic.cycleengine.domain.model.UserPosition;
import com.synthetic.cycleengine.domain.model.UserRequest;
import com.synthetic.cycleengine.domain.service.AssetPool;
import com.synthetic.cycleengine.domain.service.AssetPoolRegistry;
import com.synthetic.cycleengine.domain.service.UserLedger;
import com.synthetic.cycleengine.infra.disruptor.ProtocolCommandGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/pools/{symbol}/users")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class UserPoolController {

    private final AssetPoolRegistry registry;
    private final ProtocolCommandGateway gateway;
    private final ReserveToken reserveToken;

    @PostMapping("/deposit")
    public ResponseEntity<Map<String, Object>> deposit(@PathVariable String symbol, @RequestBody DepositRequest body) {
        AssetPool pool = registry.get(symbol);
        UserRequest request = gateway.execute(pool.symbol(), "user.deposit",
                () -> pool.users().depositRequest(body.account(), body.amount(), body.collateral()));
        return accepted(pool, body.account(), request, "deposit request recorded");
    }

    @PostMapping("/redeem")
    public ResponseEntity<Map<String, Object>> redeem(@PathVariable String symbol, @RequestBody AccountAmountRequest body) {
        AssetPool pool = registry.get(symbol);
        UserRequest request = gateway.execute(pool.symbol(), "user.redeem",
                () -> pool.users().redemptionRequest(body.account(), body.amount()));
        return accepted(pool, body.account(), request, "redemption request recorded");
    }

    @PostMapping("/liquidate")
    public ResponseEntity<Map<String, Object>> liquidate(@PathVariable String symbol, @RequestBody LiquidationRequest body) {
        AssetPool pool = registry.get(symbol);
        UserRequest request = gateway.execute(pool.symbol(), "user.liquidate",
                () -> pool.users().liquidationRequest(body.liquidator(), body.target(), body.amount()));
        return accepted(pool, body.liquidator(), request, "liquidation request recorded");
    }

    @PostMapping("/{account}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String symbol, @PathVariable String account) {
        AssetPool pool = registry.get(symbol);
        gateway.run(pool.symbol(), "user.cancel", () -> pool.users().cancelRequest(account));
        return ResponseEntity.ok(Map.of(
                "success", true,
                "symbol", pool.symbol(),
                "account", account,
                "message", "request cancelled and escrow refunded"));
    }

    @PostMapping("/{account}/claim-asset")
    public ResponseEntity<Map<String, Object>> claimAsset(@PathVariable String symbol, @PathVariable String account) {
        AssetPool pool = registry.get(symbol);
        ClaimResult result = gateway.execute(pool.symbol(), "user.claimAsset", () -> pool.users().claimAsset(account));
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "claim", result));
    }

    @PostMapping("/{account}/claim-reserve")
    public ResponseEntity<Map<String, Object>> claimReserve(@PathVariable String symbol, @PathVariable String account) {
        AssetPool pool = registry.get(symbol);
        ClaimResult result = gateway.execute(pool.symbol(), "user.claimReserve", () -> pool.users().claimReserve(account));
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "claim", result));
    }

    @PostMapping("/collateral/add")
    public ResponseEntity<Map<String, Object>> addCollateral(@PathVariable String symbol,
                                                             @RequestBody AccountAmountRequest body) {
        AssetPool pool = registry.get(symbol);
        gateway.run(pool.symbol(), "user.addCollateral", () -> pool.users().addCollateral(body.account(), body.amount()));
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "message", "collateral added"));
    }

    @PostMapping("/collateral/reduce")
    public ResponseEntity<Map<String, Object>> reduceCollateral(@PathVariable String symbol,
                                                                @RequestBody AccountAmountRequest body) {
        AssetPool pool = registry.get(symbol);
        gateway.run(pool.symbol(), "user.reduceCollateral",
                () -> pool.users().reduceCollateral(body.account(), body.amount()));
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "message", "collateral reduced"));
    }

    @PostMapping("/exit")
    public ResponseEntity<Map<String, Object>> exit(@PathVariable String symbol, @RequestBody AccountAmountRequest body) {
        AssetPool pool = registry.get(symbol);
        BigDecimal paid = gateway.execute(pool.symbol(), "user.exit",
                () -> pool.users().exitPool(body.account(), body.amount()));
        log.info("[User API] {} halted exit: account={}, paid={}", pool.symbol(), body.account(), paid.toPlainString());
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "paid", paid));
    }

    @GetMapping("/{account}")
    public ResponseEntity<UserAccountView> account(@PathVariable String symbol, @PathVariable String account) {
        AssetPool pool = registry.get(symbol);
        UserAccountView view = gateway.execute(pool.symbol(), "user.view", () -> view(pool, account));
        return ResponseEntity.ok(view);
    }

    private UserAccountView view(AssetPool pool, String account) {
        UserLedger users = pool.users();
        UserPosition position = users.position(account).orElse(null);
        boolean priced = pool.oracle().latestQuote() != null;
        HealthStatus health = position == null || !priced ? null : users.health(account);
        BigDecimal debt = position == null || !priced ? BigDecimal.ZERO : users.interestDebt(account);
        return new UserAccountView(account, users.assetAmount(account), position, users.request(account),
                health, debt, pool.token().balanceOf(account), reserveToken.balanceOf(account));
    }

    private ResponseEntity<Map<String, Object>> accepted(AssetPool pool, String account, UserRequest request,
                                                         String message) {
        log.info("[User API] {} {}: account={}, cycle={}", pool.symbol(), request.type(), account, request.cycle());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "symbol", pool.symbol(),
                "request", request,
                "message", message));
    }
}
