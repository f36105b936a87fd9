package com.fintech.escrow.ledger;

import com.fintech.escrow.exception.LedgerSubmissionException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-process ledger hosting the escrow contract.
 * <p>
 * Simulates the chain behavior the settlement engine depends on:
 * - Every submitted transaction is mined into its own block
 * - Accounts hold balances and the sender must hold the attached value
 * - Reverted transactions produce a failed receipt with no logs
 * - A controllable clock ({@link #advanceTime}) and empty blocks ({@link #mineBlocks})
 * - Outages and value-rejecting recipients, for testing resilience
 * <p>
 * In production this is replaced by {@link Web3jLedgerClient}.
 */
@Slf4j
public class SimulatedLedger implements LedgerClient {

    private final String connectionName;
    private final String contractAddress;
    private final EscrowLedgerContract contract;
    private final Clock clock;

    private final List<Block> blocks = new ArrayList<>();
    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Map<String, LedgerReceipt> receipts = new HashMap<>();
    private final Set<String> rejectingAddresses = new HashSet<>();

    private long timeOffsetSeconds;
    private long transactionCount;
    private volatile boolean simulateOutage = false;

    public SimulatedLedger(String connectionName, String contractAddress, String owner,
                           String feeRecipient, Clock clock) {
        this.connectionName = connectionName;
        this.contractAddress = LedgerAddresses.normalize(contractAddress);
        this.contract = new EscrowLedgerContract(owner, feeRecipient);
        this.clock = clock;
        appendBlock(Collections.emptyList());
        log.info("Simulated ledger {} started with escrow contract at {}", connectionName, this.contractAddress);
    }

    @Override
    public String getConnectionName() {
        return connectionName;
    }

    @Override
    public String getContractAddress() {
        return contractAddress;
    }

    @Override
    public synchronized long latestBlockNumber() {
        checkAvailable();
        return blocks.size() - 1L;
    }

    @Override
    public synchronized Optional<LedgerReceipt> getReceipt(String txReference) {
        checkAvailable();
        if (txReference == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(receipts.get(txReference.toLowerCase(Locale.ROOT)));
    }

    /**
     * Transactions are mined as they are submitted, so the ledger knows
     * exactly those it has a receipt for.
     */
    @Override
    public synchronized boolean isKnownTransaction(String txReference) {
        return getReceipt(txReference).isPresent();
    }

    @Override
    public synchronized List<LoggedEvent> getEvents(long fromBlock, long toBlock) {
        checkAvailable();
        List<LoggedEvent> events = new ArrayList<>();
        long last = Math.min(toBlock, blocks.size() - 1L);
        for (long number = Math.max(0, fromBlock); number <= last; number++) {
            events.addAll(blocks.get((int) number).events());
        }
        return events;
    }

    @Override
    public String submit(LedgerCall call, TransactionSigner signer) {
        return submitFrom(signer.getAddress(), call);
    }

    /**
     * Mines a call sent from the given address. Stands in for a party signing
     * with their own wallet.
     */
    public synchronized String submitFrom(String sender, LedgerCall call) {
        checkAvailable();
        String from = LedgerAddresses.normalize(sender);
        long blockNumber = blocks.size();
        long timestamp = currentTimestamp();
        String txReference = Hash.sha3String(String.format("%s:%s:%d:%d:%s",
                connectionName, from, transactionCount++, blockNumber, call.getFunction().getWireName()));

        ExecutionContext ctx = new ExecutionContext(from, call.getValue(), timestamp);
        String revertReason = null;
        if (balanceOf(from).compareTo(call.getValue()) < 0) {
            revertReason = "Insufficient funds for value transfer";
        } else {
            try {
                contract.execute(ctx, call);
            } catch (LedgerRevertException e) {
                revertReason = e.getReason();
            }
        }

        List<LedgerEvent> emitted = revertReason == null ? ctx.events : Collections.emptyList();
        if (revertReason == null) {
            debit(from, call.getValue());
            credit(contractAddress, call.getValue());
            for (Transfer transfer : ctx.transfers) {
                debit(contractAddress, transfer.amount());
                credit(transfer.to(), transfer.amount());
            }
        }

        Block block = appendBlock(emitted, txReference);
        LedgerReceipt receipt = new LedgerReceipt(txReference, block.number(), block.hash(),
                revertReason == null, from, contractAddress, call.getValue(), revertReason, block.events());
        receipts.put(txReference, receipt);

        if (revertReason == null) {
            log.debug("Mined {} from {} in block {} ({} events)",
                    call.getFunction().getWireName(), from, block.number(), block.events().size());
        } else {
            log.debug("Reverted {} from {} in block {}: {}",
                    call.getFunction().getWireName(), from, block.number(), revertReason);
        }
        return txReference;
    }

    @Override
    public synchronized Optional<Trade> getTrade(long tradeId) {
        checkAvailable();
        if (tradeId < 0 || tradeId >= contract.getTotalTrades()) {
            return Optional.empty();
        }
        return Optional.of(contract.getTrade(tradeId));
    }

    @Override
    public boolean isAvailable() {
        return !simulateOutage;
    }

    // Methods for testing/simulation control

    public synchronized void mineBlocks(int count) {
        for (int i = 0; i < count; i++) {
            appendBlock(Collections.emptyList());
        }
    }

    public synchronized void advanceTime(Duration duration) {
        timeOffsetSeconds += duration.getSeconds();
        log.info("Simulated ledger clock advanced by {}", duration);
    }

    public synchronized long currentTimestamp() {
        long now = clock.instant().getEpochSecond() + timeOffsetSeconds;
        if (!blocks.isEmpty()) {
            now = Math.max(now, blocks.get(blocks.size() - 1).timestamp());
        }
        return now;
    }

    public synchronized void credit(String address, BigInteger amount) {
        balances.merge(LedgerAddresses.normalize(address), amount, BigInteger::add);
    }

    public synchronized BigInteger balanceOf(String address) {
        return balances.getOrDefault(LedgerAddresses.normalize(address), BigInteger.ZERO);
    }

    public synchronized void setRejectIncomingValue(String address, boolean reject) {
        if (reject) {
            rejectingAddresses.add(LedgerAddresses.normalize(address));
        } else {
            rejectingAddresses.remove(LedgerAddresses.normalize(address));
        }
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Ledger outage simulation set to: {}", outage);
    }

    public EscrowLedgerContract getContract() {
        return contract;
    }

    private void debit(String address, BigInteger amount) {
        balances.merge(address, amount.negate(), BigInteger::add);
    }

    private void checkAvailable() {
        if (simulateOutage) {
            throw new LedgerSubmissionException("Ledger node is currently unavailable", connectionName);
        }
    }

    private Block appendBlock(List<LedgerEvent> events) {
        return appendBlock(events, null);
    }

    private Block appendBlock(List<LedgerEvent> events, String txReference) {
        long number = blocks.size();
        long timestamp = currentTimestamp();
        String hash = Hash.sha3String(connectionName + ":block:" + number + ":" + timestamp);
        List<LoggedEvent> logged = new ArrayList<>();
        for (int i = 0; i < events.size(); i++) {
            logged.add(new LoggedEvent(events.get(i), txReference, number, hash, i));
        }
        Block block = new Block(number, hash, timestamp, Collections.unmodifiableList(logged));
        blocks.add(block);
        return block;
    }

    private record Block(long number, String hash, long timestamp, List<LoggedEvent> events) {
    }

    private record Transfer(String to, BigInteger amount) {
    }

    private final class ExecutionContext implements CallContext {

        private final String sender;
        private final BigInteger value;
        private final long timestamp;
        private final List<Transfer> transfers = new ArrayList<>();
        private final List<LedgerEvent> events = new ArrayList<>();

        private ExecutionContext(String sender, BigInteger value, long timestamp) {
            this.sender = sender;
            this.value = value;
            this.timestamp = timestamp;
        }

        @Override
        public String sender() {
            return sender;
        }

        @Override
        public BigInteger value() {
            return value;
        }

        @Override
        public long timestamp() {
            return timestamp;
        }

        @Override
        public void transfer(String to, BigInteger amount) {
            String recipient = LedgerAddresses.normalize(to);
            if (rejectingAddresses.contains(recipient)) {
                throw new LedgerRevertException("Transfer failed");
            }
            transfers.add(new Transfer(recipient, amount));
        }

        @Override
        public void emit(LedgerEvent event) {
            events.add(event);
        }
    }
}
