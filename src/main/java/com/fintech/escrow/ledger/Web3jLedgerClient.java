package com.fintech.escrow.ledger;

import com.fintech.escrow.config.LedgerProperties;
import com.fintech.escrow.exception.LedgerSubmissionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.crypto.RawTransaction;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * JSON-RPC client for a deployed HedgeEscrow contract.
 * <p>
 * Reads are idempotent and retried with backoff. Submissions are never
 * retried here: a broadcast whose outcome is unknown must be resolved by
 * looking for its receipt, not by sending it again.
 */
@Slf4j
public class Web3jLedgerClient implements LedgerClient {

    private final Web3j web3j;
    private final LedgerProperties properties;
    private final String contractAddress;

    public Web3jLedgerClient(Web3j web3j, LedgerProperties properties) {
        this.web3j = web3j;
        this.properties = properties;
        this.contractAddress = LedgerAddresses.normalize(properties.getContractAddress());
        log.info("Web3j ledger client {} bound to escrow contract {} on chain {}",
                properties.getConnectionName(), contractAddress, properties.getChainId());
    }

    @Override
    public String getConnectionName() {
        return properties.getConnectionName();
    }

    @Override
    public String getContractAddress() {
        return contractAddress;
    }

    @Override
    @Retryable(
            retryFor = LedgerSubmissionException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 500, multiplier = 2)
    )
    public long latestBlockNumber() {
        try {
            return checked(web3j.ethBlockNumber().send(), "eth_blockNumber")
                    .getBlockNumber()
                    .longValueExact();
        } catch (IOException e) {
            throw new LedgerSubmissionException("Failed to read latest block number", getConnectionName(), e);
        }
    }

    @Override
    @Retryable(
            retryFor = LedgerSubmissionException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 500, multiplier = 2)
    )
    public Optional<LedgerReceipt> getReceipt(String txReference) {
        try {
            Optional<TransactionReceipt> found = checked(
                    web3j.ethGetTransactionReceipt(txReference).send(), "eth_getTransactionReceipt")
                    .getTransactionReceipt();
            if (found.isEmpty()) {
                log.debug("No receipt yet for {}", txReference);
                return Optional.empty();
            }
            TransactionReceipt receipt = found.get();

            BigInteger value = checked(web3j.ethGetTransactionByHash(txReference).send(), "eth_getTransactionByHash")
                    .getTransaction()
                    .map(org.web3j.protocol.core.methods.response.Transaction::getValue)
                    .orElse(BigInteger.ZERO);

            boolean success = receipt.isStatusOK();
            List<LoggedEvent> events = success ? decodeLogs(receipt.getLogs()) : List.of();

            return Optional.of(new LedgerReceipt(
                    receipt.getTransactionHash(),
                    receipt.getBlockNumber().longValueExact(),
                    receipt.getBlockHash(),
                    success,
                    lower(receipt.getFrom()),
                    lower(receipt.getTo()),
                    value,
                    success ? null : receipt.getRevertReason(),
                    events));
        } catch (IOException e) {
            throw new LedgerSubmissionException("Failed to fetch receipt", getConnectionName(), e);
        }
    }

    @Override
    @Retryable(
            retryFor = LedgerSubmissionException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 500, multiplier = 2)
    )
    public boolean isKnownTransaction(String txReference) {
        try {
            return checked(web3j.ethGetTransactionByHash(txReference).send(), "eth_getTransactionByHash")
                    .getTransaction()
                    .isPresent();
        } catch (IOException e) {
            throw new LedgerSubmissionException("Failed to look up transaction", getConnectionName(), e);
        }
    }

    @Override
    @Retryable(
            retryFor = LedgerSubmissionException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 500, multiplier = 2)
    )
    public List<LoggedEvent> getEvents(long fromBlock, long toBlock) {
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
                DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)),
                contractAddress);
        try {
            EthLog response = checked(web3j.ethGetLogs(filter).send(), "eth_getLogs");
            List<Log> logs = new ArrayList<>();
            for (EthLog.LogResult<?> result : response.getLogs()) {
                if (result instanceof EthLog.LogObject) {
                    logs.add(((EthLog.LogObject) result).get());
                }
            }
            logs.sort(Comparator.comparing(Log::getBlockNumber).thenComparing(Log::getLogIndex));
            return decodeLogs(logs);
        } catch (IOException e) {
            throw new LedgerSubmissionException(
                    String.format("Failed to fetch logs for blocks %d-%d", fromBlock, toBlock),
                    getConnectionName(), e);
        }
    }

    @Override
    public String submit(LedgerCall call, TransactionSigner signer) {
        String data = FunctionEncoder.encode(HedgeEscrowAbi.toFunction(call));
        try {
            BigInteger nonce = checked(
                    web3j.ethGetTransactionCount(signer.getAddress(), DefaultBlockParameterName.PENDING).send(),
                    "eth_getTransactionCount")
                    .getTransactionCount();

            RawTransaction transaction = RawTransaction.createTransaction(
                    nonce,
                    BigInteger.valueOf(properties.getGasPrice()),
                    BigInteger.valueOf(properties.getGasLimit()),
                    contractAddress,
                    call.getValue(),
                    data);

            byte[] signed = signer.sign(transaction, properties.getChainId());
            EthSendTransaction response = web3j.ethSendRawTransaction(Numeric.toHexString(signed)).send();
            if (response.hasError()) {
                throw new LedgerSubmissionException(
                        "Ledger rejected " + call.getFunction().getWireName() + ": " + response.getError().getMessage(),
                        getConnectionName(), null, false);
            }

            log.info("Submitted {} from {} as {}", call.getFunction().getWireName(),
                    signer.getAddress(), response.getTransactionHash());
            return response.getTransactionHash();
        } catch (IOException e) {
            throw new LedgerSubmissionException(
                    "Failed to submit " + call.getFunction().getWireName(), getConnectionName(), e);
        }
    }

    @Override
    @Retryable(
            retryFor = LedgerSubmissionException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 500, multiplier = 2)
    )
    public Optional<Trade> getTrade(long tradeId) {
        Function function = HedgeEscrowAbi.getTrade(tradeId);
        try {
            EthCall response = web3j.ethCall(
                    Transaction.createEthCallTransaction(null, contractAddress, FunctionEncoder.encode(function)),
                    DefaultBlockParameterName.LATEST).send();
            if (response.isReverted()) {
                log.debug("getTrade({}) reverted: {}", tradeId, response.getRevertReason());
                return Optional.empty();
            }
            checked(response, "eth_call");

            List<Type> values = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
            if (values.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(HedgeEscrowAbi.toTrade(tradeId, values));
        } catch (IOException e) {
            throw new LedgerSubmissionException("Failed to read trade " + tradeId, getConnectionName(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            return !web3j.ethBlockNumber().send().hasError();
        } catch (IOException e) {
            log.warn("Ledger node {} unreachable: {}", properties.getNodeUrl(), e.getMessage());
            return false;
        }
    }

    private List<LoggedEvent> decodeLogs(List<Log> logs) {
        List<LoggedEvent> events = new ArrayList<>();
        for (Log entry : logs) {
            if (!LedgerAddresses.same(entry.getAddress(), contractAddress)) {
                continue;
            }
            HedgeEscrowAbi.decode(entry).ifPresent(event -> events.add(new LoggedEvent(
                    event,
                    entry.getTransactionHash(),
                    entry.getBlockNumber().longValueExact(),
                    entry.getBlockHash(),
                    entry.getLogIndex().longValueExact())));
        }
        return events;
    }

    private <T extends Response<?>> T checked(T response, String method) {
        if (response.hasError()) {
            throw new LedgerSubmissionException(
                    method + " failed: " + response.getError().getMessage(), getConnectionName());
        }
        return response;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
