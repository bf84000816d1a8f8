package com.equorum.governance.ledger;

import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import io.micronaut.context.annotation.Value;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.MediaType;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.exceptions.HttpClientException;
import io.micronaut.http.uri.UriBuilder;
import io.micronaut.serde.annotation.Serdeable;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;

/**
 * {@link TokenLedger} backed by the token ledger's HTTP API.
 *
 * <pre>
 * GET  {token-ledger.url}/balances/{principal}   -> {"balance": n}
 * POST {token-ledger.url}/transfers {from,to,amount} -> {"success": bool}
 * </pre>
 */
@Singleton
public class HttpTokenLedger implements TokenLedger {

    private static final Logger log = LoggerFactory.getLogger(HttpTokenLedger.class);

    @Value("${token-ledger.url:`http://localhost:8545`}")
    String ledgerUrl;

    private HttpClient client;

    @Serdeable
    record BalanceResponse(BigInteger balance) {}

    @Serdeable
    record TransferRequest(String from, String to, BigInteger amount) {}

    @Serdeable
    record TransferResponse(boolean success) {}

    @Override
    public BigInteger balanceOf(String principal) {
        URI uri = UriBuilder.of(ledgerUrl).path("balances").path(principal).build();
        try {
            BalanceResponse resp = client().toBlocking().retrieve(HttpRequest.GET(uri), BalanceResponse.class);
            return resp.balance() != null ? resp.balance() : BigInteger.ZERO;
        } catch (HttpClientException e) {
            log.warn("Token ledger balance query failed for principal={}: {}", principal, e.getMessage());
            throw new GovernanceException(ErrorCode.LEDGER_UNAVAILABLE, "Token ledger unavailable", e);
        }
    }

    @Override
    public boolean transferFrom(String from, String to, BigInteger amount) {
        URI uri = UriBuilder.of(ledgerUrl).path("transfers").build();
        try {
            TransferResponse resp = client().toBlocking().retrieve(
                HttpRequest.POST(uri, new TransferRequest(from, to, amount)).contentType(MediaType.APPLICATION_JSON_TYPE),
                TransferResponse.class);
            log.debug("Token ledger transfer from={} to={} amount={} success={}", from, to, amount, resp.success());
            return resp.success();
        } catch (HttpClientException e) {
            log.warn("Token ledger transfer failed from={} to={} amount={}: {}", from, to, amount, e.getMessage());
            throw new GovernanceException(ErrorCode.LEDGER_UNAVAILABLE, "Token ledger unavailable", e);
        }
    }

    private synchronized HttpClient client() {
        if (client == null) {
            try {
                client = HttpClient.create(new URL(ledgerUrl));
            } catch (MalformedURLException e) {
                throw new IllegalStateException("Invalid token-ledger.url: " + ledgerUrl, e);
            }
        }
        return client;
    }

    @PreDestroy
    synchronized void close() {
        if (client != null) {
            client.close();
        }
    }
}
