package com.mintstream.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintstream.domain.enums.TradeSide;
import com.mintstream.domain.model.TokenCreation;
import com.mintstream.domain.model.TokenTrade;
import com.mintstream.exception.MalformedFeedMessageException;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Turns raw feed frames into {@link FeedMessage} variants.
 *
 * <p>Shapes are tried in this order:
 * <ol>
 *   <li>{@code txType == "create"}: token created</li>
 *   <li>{@code txType} is "buy" or "sell": trade</li>
 *   <li>{@code method == "newToken"}: token created (older frames without txType)</li>
 *   <li>a {@code mint} field is present: trade</li>
 *   <li>anything else: unrecognized</li>
 * </ol>
 *
 * <p>Timestamps are not taken from the feed; the services stamp records when storing them.
 */
@Component
public class FeedMessageDecoder {

    static final String TX_TYPE_CREATE = "create";
    static final String METHOD_NEW_TOKEN = "newToken";

    private final ObjectMapper objectMapper;

    public FeedMessageDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MalformedFeedMessageException if the payload is not a JSON object
     */
    public FeedMessage decode(String payload) {
        JsonNode node = parse(payload);
        String txType = text(node, "txType");

        if (TX_TYPE_CREATE.equals(txType)) {
            return new FeedMessage.TokenCreated(toCreation(node));
        }
        if (TradeSide.fromWire(txType).isPresent()) {
            return new FeedMessage.TokenTraded(toTrade(node));
        }
        if (METHOD_NEW_TOKEN.equals(text(node, "method"))) {
            return new FeedMessage.TokenCreated(toCreation(node));
        }
        if (node.hasNonNull("mint")) {
            return new FeedMessage.TokenTraded(toTrade(node));
        }
        return new FeedMessage.Unrecognized(summarize(node));
    }

    private JsonNode parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedFeedMessageException("Empty feed message", payload);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedFeedMessageException("Feed message is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedFeedMessageException("Feed message is not a JSON object", payload);
        }
        return node;
    }

    private TokenCreation toCreation(JsonNode node) {
        return TokenCreation.builder()
                .signature(text(node, "signature"))
                .mint(text(node, "mint"))
                .traderPublicKey(text(node, "traderPublicKey"))
                .txType(text(node, "txType"))
                .initialBuy(decimal(node, "initialBuy"))
                .solAmount(decimal(node, "solAmount"))
                .bondingCurveKey(text(node, "bondingCurveKey"))
                .virtualTokenReserves(decimal(node, "vTokensInBondingCurve"))
                .virtualSolReserves(decimal(node, "vSolInBondingCurve"))
                .marketCapSol(decimal(node, "marketCapSol"))
                .name(text(node, "name"))
                .symbol(text(node, "symbol"))
                .uri(text(node, "uri"))
                .pool(text(node, "pool"))
                .build();
    }

    private TokenTrade toTrade(JsonNode node) {
        return TokenTrade.builder()
                .mint(text(node, "mint"))
                .traderPublicKey(text(node, "traderPublicKey"))
                .txType(text(node, "txType"))
                .solAmount(decimal(node, "solAmount"))
                .virtualTokenReserves(decimal(node, "vTokensInBondingCurve"))
                .virtualSolReserves(decimal(node, "vSolInBondingCurve"))
                .marketCapSol(decimal(node, "marketCapSol"))
                .build();
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedFeedMessageException("Field " + field + " is not numeric", node.toString());
            }
        }
        throw new MalformedFeedMessageException("Field " + field + " is not numeric", node.toString());
    }

    private String summarize(JsonNode node) {
        String message = text(node, "message");
        if (message != null) {
            return message;
        }
        String json = node.toString();
        return json.length() <= 120 ? json : json.substring(0, 120) + "...";
    }
}
