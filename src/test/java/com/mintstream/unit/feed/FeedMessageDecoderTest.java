package com.mintstream.unit.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintstream.domain.model.TokenCreation;
import com.mintstream.domain.model.TokenTrade;
import com.mintstream.exception.MalformedFeedMessageException;
import com.mintstream.feed.FeedMessage;
import com.mintstream.feed.FeedMessageDecoder;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link FeedMessageDecoder}: shape classification order and malformed input.
 */
class FeedMessageDecoderTest {

    private FeedMessageDecoder feedMessageDecoder;

    @BeforeEach
    void setUp() {
        feedMessageDecoder = new FeedMessageDecoder(new ObjectMapper());
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("txType create decodes to a token creation with all fields")
        void createMessage() {
            FeedMessage message = feedMessageDecoder.decode("""
                    {"signature":"sig1","mint":"MintX","traderPublicKey":"Dev1","txType":"create",
                     "initialBuy":1000000,"solAmount":0.5,"bondingCurveKey":"Curve1",
                     "vTokensInBondingCurve":1072999999.5,"vSolInBondingCurve":30.5,
                     "marketCapSol":28.4,"name":"Example","symbol":"EXM",
                     "uri":"https://example.org/meta.json","pool":"pump"}
                    """);

            assertThat(message).isInstanceOf(FeedMessage.TokenCreated.class);
            TokenCreation creation = ((FeedMessage.TokenCreated) message).creation();
            assertThat(creation.getMint()).isEqualTo("MintX");
            assertThat(creation.getSignature()).isEqualTo("sig1");
            assertThat(creation.getSymbol()).isEqualTo("EXM");
            assertThat(creation.getInitialBuy()).isEqualByComparingTo("1000000");
            assertThat(creation.getVirtualTokenReserves()).isEqualByComparingTo("1072999999.5");
            assertThat(creation.getVirtualSolReserves()).isEqualByComparingTo("30.5");
            assertThat(creation.getMarketCapSol()).isEqualByComparingTo("28.4");
            assertThat(creation.getPool()).isEqualTo("pump");
            assertThat(creation.getCreatedAt()).isNull();
        }

        @Test
        @DisplayName("txType buy and sell decode to trades")
        void buyAndSell() {
            FeedMessage buy = feedMessageDecoder.decode(
                    "{\"mint\":\"MintX\",\"txType\":\"buy\",\"solAmount\":0.2,\"traderPublicKey\":\"T1\"}");
            FeedMessage sell = feedMessageDecoder.decode("{\"mint\":\"MintX\",\"txType\":\"sell\",\"solAmount\":\"0.1\"}");

            assertThat(buy).isInstanceOf(FeedMessage.TokenTraded.class);
            TokenTrade trade = ((FeedMessage.TokenTraded) buy).trade();
            assertThat(trade.getMint()).isEqualTo("MintX");
            assertThat(trade.getTxType()).isEqualTo("buy");
            assertThat(trade.getTraderPublicKey()).isEqualTo("T1");
            assertThat(trade.getSolAmount()).isEqualByComparingTo(new BigDecimal("0.2"));

            assertThat(sell).isInstanceOf(FeedMessage.TokenTraded.class);
            assertThat(((FeedMessage.TokenTraded) sell).trade().getSolAmount()).isEqualByComparingTo("0.1");
        }

        @Test
        @DisplayName("method newToken without txType decodes to a token creation")
        void newTokenMethod() {
            FeedMessage message = feedMessageDecoder.decode("{\"method\":\"newToken\",\"mint\":\"MintY\",\"symbol\":\"Y\"}");

            assertThat(message).isInstanceOf(FeedMessage.TokenCreated.class);
            assertThat(((FeedMessage.TokenCreated) message).creation().getMint()).isEqualTo("MintY");
        }

        @Test
        @DisplayName("txType is checked before method: a buy tagged newToken is still a trade")
        void txTypeWinsOverMethod() {
            FeedMessage message =
                    feedMessageDecoder.decode("{\"method\":\"newToken\",\"txType\":\"buy\",\"mint\":\"MintY\"}");

            assertThat(message).isInstanceOf(FeedMessage.TokenTraded.class);
        }

        @Test
        @DisplayName("a bare mint field decodes to a trade")
        void bareMint() {
            FeedMessage message = feedMessageDecoder.decode("{\"mint\":\"MintZ\",\"solAmount\":1}");

            assertThat(message).isInstanceOf(FeedMessage.TokenTraded.class);
            assertThat(((FeedMessage.TokenTraded) message).trade().getTxType()).isNull();
        }

        @Test
        @DisplayName("subscription acknowledgements are unrecognized")
        void acknowledgement() {
            FeedMessage message =
                    feedMessageDecoder.decode("{\"message\":\"Successfully subscribed to token creation events.\"}");

            assertThat(message).isInstanceOf(FeedMessage.Unrecognized.class);
            assertThat(((FeedMessage.Unrecognized) message).summary()).startsWith("Successfully subscribed");
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class Malformed {

        @Test
        @DisplayName("invalid JSON is rejected")
        void invalidJson() {
            assertThatThrownBy(() -> feedMessageDecoder.decode("{not json"))
                    .isInstanceOf(MalformedFeedMessageException.class);
        }

        @Test
        @DisplayName("blank and non-object payloads are rejected")
        void blankAndNonObject() {
            assertThatThrownBy(() -> feedMessageDecoder.decode("  "))
                    .isInstanceOf(MalformedFeedMessageException.class);
            assertThatThrownBy(() -> feedMessageDecoder.decode("[1,2,3]"))
                    .isInstanceOf(MalformedFeedMessageException.class);
            assertThatThrownBy(() -> feedMessageDecoder.decode("\"text\""))
                    .isInstanceOf(MalformedFeedMessageException.class);
        }

        @Test
        @DisplayName("non-numeric amount is rejected")
        void nonNumericAmount() {
            assertThatThrownBy(() -> feedMessageDecoder.decode("{\"mint\":\"MintX\",\"txType\":\"buy\",\"solAmount\":\"lots\"}"))
                    .isInstanceOf(MalformedFeedMessageException.class)
                    .hasMessageContaining("solAmount");
        }
    }
}
