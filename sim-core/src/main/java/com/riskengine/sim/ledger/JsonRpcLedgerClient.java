package com.riskengine.sim.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.http.HttpService;

import java.io.IOException;
import java.net.URI;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link LedgerClient} over the ledger node's JSON-RPC endpoint, using web3j's HTTP JSON-RPC transport.
 */
@Slf4j
public class JsonRpcLedgerClient implements LedgerClient {

  private final Web3jService service;
  private final String commitment;

  public JsonRpcLedgerClient(@NonNull URI rpcUrl, @NonNull String commitment) {
    this(new HttpService(rpcUrl.toString()), commitment);
  }

  JsonRpcLedgerClient(@NonNull Web3jService service, @NonNull String commitment) {
    this.service = service;
    this.commitment = commitment;
  }

  @Override
  public RecentBlockhash latestBlockhash() throws IOException {
    JsonNode value = call("getLatestBlockhash", commitmentConfig()).path("value");
    String blockhash = value.path("blockhash").asText(null);
    if (blockhash == null || blockhash.isBlank()) {
      throw new LedgerRpcException("getLatestBlockhash returned no blockhash");
    }
    return new RecentBlockhash(blockhash, value.path("lastValidBlockHeight").asLong());
  }

  @Override
  public String sendTransaction(byte[] wireTransaction) throws IOException {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("encoding", "base64");
    config.put("skipPreflight", true);
    config.put("preflightCommitment", commitment);
    JsonNode result = call("sendTransaction", Base64.getEncoder().encodeToString(wireTransaction), config);
    if (!result.isTextual()) {
      throw new LedgerRpcException("sendTransaction returned no signature");
    }
    return result.asText();
  }

  @Override
  public Optional<SignatureStatus> signatureStatus(String signature) throws IOException {
    JsonNode value = call("getSignatureStatuses", List.of(signature), Map.of("searchTransactionHistory", true))
        .path("value");
    if (!value.isArray() || value.isEmpty() || value.get(0).isNull()) {
      return Optional.empty();
    }
    JsonNode status = value.get(0);
    JsonNode err = status.path("err");
    String error = err.isMissingNode() || err.isNull() ? null : err.toString();
    return Optional.of(new SignatureStatus(status.path("confirmationStatus").asText(null), error));
  }

  @Override
  public long blockHeight() throws IOException {
    return call("getBlockHeight", commitmentConfig()).asLong();
  }

  @Override
  public Optional<byte[]> accountData(LedgerPublicKey account) throws IOException {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("encoding", "base64");
    config.put("commitment", commitment);
    JsonNode value = call("getAccountInfo", account.toBase58(), config).path("value");
    if (value.isMissingNode() || value.isNull()) {
      return Optional.empty();
    }
    JsonNode data = value.path("data");
    String encoded = data.isArray() ? data.path(0).asText("") : data.asText("");
    return Optional.of(Base64.getDecoder().decode(encoded));
  }

  @Override
  public long slot() throws IOException {
    return call("getSlot", commitmentConfig()).asLong();
  }

  @Override
  public OptionalLong blockTime(long slot) throws IOException {
    JsonNode result = call("getBlockTime", slot);
    return result.isNumber() ? OptionalLong.of(result.asLong()) : OptionalLong.empty();
  }

  private Map<String, Object> commitmentConfig() {
    return Map.of("commitment", commitment);
  }

  private JsonNode call(String method, Object... params) throws IOException {
    List<Object> paramList = Arrays.asList(params);
    Request<Object, JsonResponse> request = new Request<>(method, paramList, service, JsonResponse.class);
    JsonResponse response;
    try {
      response = request.send();
    } catch (IOException e) {
      throw new LedgerRpcException(method + " transport error: " + e.getMessage(), e);
    }
    if (response.hasError()) {
      Response.Error error = response.getError();
      throw new LedgerRpcException(method + " error " + error.getCode() + ": " + error.getMessage());
    }
    JsonNode result = response.getResult();
    if (result == null) {
      log.debug("{} returned null result", method);
      return NullNode.getInstance();
    }
    return result;
  }

  public static class JsonResponse extends Response<JsonNode> {
  }
}
