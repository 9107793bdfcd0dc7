package com.synthetic.cycleengine.api;

import com.synthetic.cycleengine.api.dto.AccountAmountRequest;
import com.synthetic.cycleengine.api.dto.AdminTargetRequest;
import com.synthetic.cycleengine.api.dto.LiquidationRequest;
import com.synthetic.cycleengine.api.dto.LiquidityAccountView;
import com.synthetic.cycleengine.domain.external.ReserveToken;
import com.synthetic.cycleengine.domain.model.HealthStatus;
import com.synthetic.cycleengine.domain.model.LiquidityPosition;
import com.synthetic.cycleengine.domain.model.LiquidityRequest;
import com.synthetic.cycleengine.domain.service.AssetPool;
import com.synthetic.cycleengine.domain.service.AssetPoolRegistry;
import com.synthetic.cycleengine.domain.service.LiquidityProviderLedger;
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
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/pools/{symbol}/lps")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class LiquidityController {

    private final AssetPoolRegistry registry;
    private final ProtocolCommandGateway gateway;
    private final ReserveToken reserveToken;

    @PostMapping("/deposit")
    public ResponseEntity<Map<String, Object>> deposit(@PathVariable String symbol, @RequestBody AccountAmountRequest body) {
        AssetPool pool = registry.get(symbol);
        gateway.run(pool.symbol(), "lp.deposit", () -> pool.liquidity().deposit(body.account(), body.amount()));
        return done(pool, "collateral deposited");
    }

    @PostMapping("/collateral/add")
    public ResponseEntity<Map<String, Object>> addCollateral(@PathVariable String symbol,
                                                             @RequestBody AccountAmountRequest body) {
        AssetPool pool = registry.get(symbol);
        gateway.run(pool.symbol(), "lp.addCollateral", () -> pool.liquidity().addCollateral(body.account(), body.amount()));
        return done(pool, "collateral added");
    }

    @PostMapping("/collateral/reduce")
    public ResponseEntity<Map<String, Object>> reduceCollateral(@PathVariable String symbol,
                                                                @RequestBody AccountAmountRequest body) {
        AssetPool pool = registry.get(symbol);
        gateway.run(pool.symbol(), "lp.reduceCollateral",
                () -> pool.liquidity().reduceCollateral(body.account(), body.amount()));
        return done(pool, "collateral reduced");
    }

    @PostMapping("/withdraw")
    public ResponseEntity<Map<String, Object>> withdraw(@PathVariable String symbol, @RequestBody AccountAmountRequest body) {
        AssetPool pool = registry.get(symbol);
        gateway.run(pool.symbol(), "lp.withdraw", () -> pool.liquidity().withdraw(body.account(), body.amount()));
        return done(pool, "collateral withdrawn");
    }

    @PostMapping("/liquidity/add")
    public ResponseEntity<Map<String, Object>> addLiquidity(@PathVariable String symbol,
                                                            @RequestBody AccountAmountRequest body) {
        AssetPool pool = registry.get(symbol);
        LiquidityRequest request = gateway.execute(pool.symbol(), "lp.addLiquidity",
                () -> pool.liquidity().addLiquidity(body.account(), body.amount()));
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "request", request));
    }

    @PostMapping("/liquidity/reduce")
    public ResponseEntity<Map<String, Object>> reduceLiquidity(@PathVariable String symbol,
                                                               @RequestBody AccountAmountRequest body) {
        AssetPool pool = registry.get(symbol);
        LiquidityRequest request = gateway.execute(pool.symbol(), "lp.reduceLiquidity",
                () -> pool.liquidity().reduceLiquidity(body.account(), body.amount()));
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "request", request));
    }

    @PostMapping("/liquidate")
    public ResponseEntity<Map<String, Object>> liquidate(@PathVariable String symbol, @RequestBody LiquidationRequest body) {
        AssetPool pool = registry.get(symbol);
        LiquidityRequest request = gateway.execute(pool.symbol(), "lp.liquidate",
                () -> pool.liquidity().liquidateLP(body.liquidator(), body.target(), body.amount()));
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "request", request));
    }

    @PostMapping("/{lp}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String symbol, @PathVariable String lp) {
        AssetPool pool = registry.get(symbol);
        gateway.run(pool.symbol(), "lp.cancel", () -> pool.liquidity().cancelRequest(lp));
        return done(pool, "request cancelled");
    }

    @PostMapping("/{lp}/claim-interest")
    public ResponseEntity<Map<String, Object>> claimInterest(@PathVariable String symbol, @PathVariable String lp) {
        AssetPool pool = registry.get(symbol);
        BigDecimal paid = gateway.execute(pool.symbol(), "lp.claimInterest", () -> pool.liquidity().claimInterest(lp));
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "paid", paid));
    }

    @PostMapping("/{lp}/exit")
    public ResponseEntity<Map<String, Object>> exit(@PathVariable String symbol, @PathVariable String lp) {
        AssetPool pool = registry.get(symbol);
        BigDecimal paid = gateway.execute(pool.symbol(), "lp.exit", () -> pool.liquidity().exitPool(lp));
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "paid", paid));
    }

    @PostMapping("/remove")
    public ResponseEntity<Map<String, Object>> remove(@PathVariable String symbol, @RequestBody AdminTargetRequest body) {
        AssetPool pool = registry.get(symbol);
        BigDecimal paid = gateway.execute(pool.symbol(), "lp.remove",
                () -> pool.liquidity().removeLP(body.admin(), body.account()));
        log.warn("[LP API] {} LP {} removed by {}", pool.symbol(), body.account(), body.admin());
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "paid", paid));
    }

    @GetMapping
    public ResponseEntity<List<LiquidityAccountView>> list(@PathVariable String symbol) {
        AssetPool pool = registry.get(symbol);
        List<LiquidityAccountView> views = gateway.execute(pool.symbol(), "lp.list",
                () -> pool.liquidity().positions().keySet().stream().map(lp -> view(pool, lp)).toList());
        return ResponseEntity.ok(views);
    }

    @GetMapping("/{lp}")
    public ResponseEntity<LiquidityAccountView> account(@PathVariable String symbol, @PathVariable String lp) {
        AssetPool pool = registry.get(symbol);
        return ResponseEntity.ok(gateway.execute(pool.symbol(), "lp.view", () -> view(pool, lp)));
    }

    private LiquidityAccountView view(AssetPool pool, String lp) {
        LiquidityProviderLedger ledger = pool.liquidity();
        LiquidityPosition position = ledger.position(lp).orElse(null);
        boolean priced = pool.oracle().latestQuote() != null;
        HealthStatus health = position == null || !priced ? null : ledger.health(lp);
        BigDecimal exposure = position == null || !priced ? BigDecimal.ZERO : ledger.exposure(position);
        return new LiquidityAccountView(lp, position, ledger.request(lp), health, exposure, reserveToken.balanceOf(lp));
    }

    private ResponseEntity<Map<String, Object>> done(AssetPool pool, String message) {
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "message", message));
    }
}
