package com.synthetic.cycleengine.api;

import com.synthetic.cycleengine.api.dto.AccountAmountRequest;
import com.synthetic.cycleengine.domain.external.ReserveToken;
import com.synthetic.cycleengine.infra.config.ProtocolProperties;
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

import java.util.Map;

/**
 * Local funding for test networks.
 */
@Slf4j
@RestController
@RequestMapping("/api/reserve")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ReserveController {

    private final ReserveToken reserveToken;
    private final ProtocolCommandGateway gateway;
    private final ProtocolProperties properties;

    @PostMapping("/faucet")
    public ResponseEntity<Map<String, Object>> faucet(@RequestBody AccountAmountRequest body) {
        ProtocolProperties.Reserve reserve = properties.getReserve();
        if (!reserve.isFaucetEnabled()) {
            return ResponseEntity.status(403).body(Map.of(
                    "success", false,
                    "message", "faucet is disabled"));
        }
        if (body.amount() == null || body.amount().compareTo(reserve.getFaucetLimit()) > 0) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "amount must be at most " + reserve.getFaucetLimit().toPlainString()));
        }
        gateway.run(reserveToken.symbol(), "reserve.faucet", () -> reserveToken.mint(body.account(), body.amount()));
        return ResponseEntity.ok(Map.of(
                "success", true,
                "account", body.account(),
                "balance", reserveToken.balanceOf(body.account())));
    }

    @GetMapping("/{account}")
    public ResponseEntity<Map<String, Object>> balance(@PathVariable String account) {
        return ResponseEntity.ok(Map.of(
                "account", account,
                "symbol", reserveToken.symbol(),
                "balance", reserveToken.balanceOf(account)));
    }
}
