package com.chicu.rebalancer.bridge.client.impl;

import com.chicu.rebalancer.bridge.client.BridgeAggregatorClient;
import com.chicu.rebalancer.bridge.client.BridgeApiProperties;
import com.chicu.rebalancer.bridge.model.ApprovalData;
import com.chicu.rebalancer.bridge.model.BridgeStatusReport;
import com.chicu.rebalancer.bridge.model.BridgeTxStatus;
import com.chicu.rebalancer.bridge.model.BuildTxResult;
import com.chicu.rebalancer.bridge.model.QuoteRequest;
import com.chicu.rebalancer.bridge.model.Route;
import com.chicu.rebalancer.exception.QuoteUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Socket (Bungee) v2: /quote, /build-tx, /bridge-status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SocketBridgeAggregatorClient implements BridgeAggregatorClient {

    private final RestTemplate rest;
    private final ObjectMapper objectMapper;
    private final BridgeApiProperties props;

    @Override
    public List<Route> quote(QuoteRequest q) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl() + "/quote")
                .queryParam("fromChainId", q.getFromChainId())
                .queryParam("toChainId", q.getToChainId())
                .queryParam("fromTokenAddress", q.getFromTokenAddress())
                .queryParam("toTokenAddress", q.getToTokenAddress())
                .queryParam("fromAmount", q.getFromAmount().toString())
                .queryParam("userAddress", q.getUserAddress())
                .queryParam("singleTxOnly", true)
                .queryParam("bridgeWithGas", false)
                .queryParam("sort", "output")
                .queryParam("defaultSwapSlippage", slippage(q).toPlainString())
                .queryParam("isContractCall", false)
                .queryParam("showAutoRoutes", false)
                .encode().build().toUri();

        log.info("Socket quote {}:{} -> {}:{} amount={}", q.getFromChainId(), q.getFromTokenAddress(),
                q.getToChainId(), q.getToTokenAddress(), q.getFromAmount());

        JsonNode result = successResult(call("quote", uri, HttpMethod.GET, null), "quote");
        JsonNode routes = result.path("routes");
        if (!routes.isArray()) {
            throw new QuoteUnavailableException("Malformed quote response: routes missing");
        }

        List<Route> out = new ArrayList<>();
        for (JsonNode r : routes) {
            out.add(new Route(r, parseAmount(r.path("toAmount"), "route.toAmount")));
        }
        log.info("Socket quote: {} route(s)", out.size());
        return out;
    }

    @Override
    public BuildTxResult buildTx(Route route) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("route", route.getRaw());
        URI uri = URI.create(baseUrl() + "/build-tx");

        JsonNode result = successResult(call("build-tx", uri, HttpMethod.POST, body.toString()), "build-tx");

        String txData = result.path("txData").asText("");
        String txTarget = result.path("txTarget").asText("");
        if (!txData.startsWith("0x") || !txTarget.startsWith("0x")) {
            throw new QuoteUnavailableException("Malformed build-tx response: txData/txTarget missing");
        }

        ApprovalData approval = null;
        JsonNode a = result.path("approvalData");
        if (a.isObject()) {
            String spender = a.path("allowanceTarget").asText("");
            if (!spender.startsWith("0x")) {
                throw new QuoteUnavailableException("Malformed build-tx response: approvalData.allowanceTarget missing");
            }
            approval = new ApprovalData(spender, parseAmount(a.path("minimumApprovalAmount"), "approvalData.minimumApprovalAmount"));
        }

        return BuildTxResult.builder()
                .txData(txData)
                .txTarget(txTarget)
                .value(result.has("value") ? parseAmount(result.path("value"), "value") : BigInteger.ZERO)
                .approvalData(approval)
                .build();
    }

    @Override
    public BridgeStatusReport bridgeStatus(String txHash, long fromChainId, long toChainId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl() + "/bridge-status")
                .queryParam("transactionHash", txHash)
                .queryParam("fromChainId", fromChainId)
                .queryParam("toChainId", toChainId)
                .encode().build().toUri();

        JsonNode result = successResult(call("bridge-status", uri, HttpMethod.GET, null), "bridge-status");
        BridgeStatusReport report = new BridgeStatusReport(
                BridgeTxStatus.parse(result.path("sourceTxStatus").asText(null)),
                BridgeTxStatus.parse(result.path("destinationTxStatus").asText(null)));
        log.debug("Socket bridge-status {}: source={} destination={}", txHash,
                report.getSourceTxStatus(), report.getDestinationTxStatus());
        return report;
    }

    /* ========== helpers ========== */

    private String call(String what, URI uri, HttpMethod method, String body) {
        try {
            return rest.exchange(uri, method, new HttpEntity<>(body, headers()), String.class).getBody();
        } catch (RestClientException e) {
            log.warn("Socket {} failed: {}", what, e.getMessage());
            throw new QuoteUnavailableException("Aggregator " + what + " request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode successResult(String body, String what) {
        JsonNode root = parseJson(body, what);
        if (!root.path("success").asBoolean(false)) {
            throw new QuoteUnavailableException("Aggregator " + what + " returned success=false");
        }
        JsonNode result = root.path("result");
        if (!result.isObject()) {
            throw new QuoteUnavailableException("Malformed " + what + " response: result missing");
        }
        return result;
    }

    private HttpHeaders headers() {
        HttpHeaders h = new HttpHeaders();
        h.set("API-KEY", props.getApiKey() == null ? "" : props.getApiKey());
        h.setContentType(MediaType.APPLICATION_JSON);
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        return h;
    }

    private String baseUrl() {
        String b = props.getBaseUrl();
        if (b == null || b.isBlank()) b = "https://api.socket.tech/v2";
        if (!b.startsWith("http")) b = "https://" + b;
        return b.replaceAll("/+$", "");
    }

    private BigDecimal slippage(QuoteRequest q) {
        if (q.getSlippage() != null) return q.getSlippage();
        return q.isSameChain() ? props.getSwapSlippage() : props.getBridgeSlippage();
    }

    private JsonNode parseJson(String body, String what) {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (Exception e) {
            throw new QuoteUnavailableException("Aggregator " + what + " JSON parse error: " + e.getMessage(), e);
        }
    }

    /** Суммы приходят строкой: десятичной или 0x-hex. */
    private static BigInteger parseAmount(JsonNode node, String field) {
        String raw = node.isMissingNode() || node.isNull() ? "" : node.asText("").trim();
        try {
            if (raw.startsWith("0x") || raw.startsWith("0X")) {
                return raw.length() == 2 ? BigInteger.ZERO : new BigInteger(raw.substring(2), 16);
            }
            BigInteger v = new BigInteger(raw);
            if (v.signum() < 0) throw new NumberFormatException("negative");
            return v;
        } catch (NumberFormatException e) {
            throw new QuoteUnavailableException("Malformed " + field + ": '" + raw + "'", e);
        }
    }
}
