package com.flagship.spv_ledger.crypto;

import com.flagship.spv_ledger.crypto.asset.DelegateAsset;
import com.flagship.spv_ledger.crypto.asset.MultiSignatureAsset;
import com.flagship.spv_ledger.crypto.asset.SecondSignatureAsset;
import com.flagship.spv_ledger.crypto.asset.TransactionAsset;
import com.flagship.spv_ledger.crypto.asset.TransferAsset;
import com.flagship.spv_ledger.crypto.asset.VoteAsset;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Binary transaction codec.
 *
 * Layout (little-endian):
 * <pre>
 * 0xFF | version u8 | network u8 | type u8 | timestamp u32 | senderPublicKey 33B | fee u64
 *      | vendorFieldLength u8 | vendorField | asset | signature (remaining bytes)
 * </pre>
 * Asset layouts:
 * <ul>
 *   <li>TRANSFER: amount u64, expiration u32, recipient 21B</li>
 *   <li>SECOND_SIGNATURE: publicKey 33B</li>
 *   <li>DELEGATE_REGISTRATION: usernameLength u8, username UTF-8</li>
 *   <li>VOTE: count u8, then per vote a prefix byte (1 = vote, 0 = unvote) and publicKey 33B</li>
 *   <li>MULTI_SIGNATURE: min u8, count u8, lifetime u8, then count x publicKey 33B</li>
 * </ul>
 */
@Component
public class BinaryTransactionCodec implements TransactionCodec {

    private static final byte MARKER = (byte) 0xFF;
    private static final HexFormat HEX = HexFormat.of();

    private final AddressFactory addressFactory;

    public BinaryTransactionCodec(AddressFactory addressFactory) {
        this.addressFactory = addressFactory;
    }

    @Override
    public Transaction deserialize(String hexPayload) {
        if (hexPayload == null || hexPayload.isEmpty()) {
            throw new TransactionDecodeException("Empty transaction payload");
        }
        byte[] bytes;
        try {
            bytes = HEX.parseHex(hexPayload);
        } catch (IllegalArgumentException e) {
            throw new TransactionDecodeException("Transaction payload is not valid hex", e);
        }

        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        try {
            if (buffer.get() != MARKER) {
                throw new TransactionDecodeException("Missing transaction marker byte");
            }
            int version = Byte.toUnsignedInt(buffer.get());
            int network = Byte.toUnsignedInt(buffer.get());
            TransactionType type = decodeType(Byte.toUnsignedInt(buffer.get()));
            long timestamp = Integer.toUnsignedLong(buffer.getInt());
            String senderPublicKey = readHex(buffer, AddressFactory.PUBLIC_KEY_LENGTH);
            long fee = buffer.getLong();
            String vendorField = readShortString(buffer);
            TransactionAsset asset = decodeAsset(type, buffer);
            String signature = buffer.hasRemaining() ? readHex(buffer, buffer.remaining()) : null;

            return Transaction.builder()
                .version(version)
                .network(network)
                .timestamp(timestamp)
                .senderPublicKey(senderPublicKey)
                .fee(fee)
                .vendorField(vendorField)
                .asset(asset)
                .signature(signature)
                .build();
        } catch (BufferUnderflowException e) {
            throw new TransactionDecodeException("Transaction payload truncated at byte " + buffer.position(), e);
        } catch (IllegalArgumentException e) {
            throw new TransactionDecodeException("Invalid transaction payload: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] serialize(Transaction transaction) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        out.write(MARKER);
        out.write(transaction.getVersion());
        out.write(transaction.getNetwork());
        out.write(transaction.getType().getCode());
        writeInt(out, (int) transaction.getTimestamp());
        out.writeBytes(AddressFactory.parsePublicKey(transaction.getSenderPublicKey()));
        writeLong(out, transaction.getFee());
        writeShortString(out, transaction.getVendorField());

        TransactionAsset asset = transaction.getAsset();
        if (asset instanceof TransferAsset transfer) {
            writeLong(out, transfer.getAmount());
            writeInt(out, (int) transfer.getExpiration());
            out.writeBytes(addressFactory.decode(transfer.getRecipientId()));
        } else if (asset instanceof SecondSignatureAsset secondSignature) {
            out.writeBytes(AddressFactory.parsePublicKey(secondSignature.getPublicKey()));
        } else if (asset instanceof DelegateAsset delegate) {
            writeShortString(out, delegate.getUsername());
        } else if (asset instanceof VoteAsset votes) {
            writeCount(out, votes.getVotes().size());
            for (String vote : votes.getVotes()) {
                out.write(vote.charAt(0) == VoteAsset.VOTE_PREFIX ? 1 : 0);
                out.writeBytes(AddressFactory.parsePublicKey(vote.substring(1)));
            }
        } else if (asset instanceof MultiSignatureAsset multiSignature) {
            out.write(multiSignature.getMin());
            writeCount(out, multiSignature.getKeysgroup().size());
            out.write(multiSignature.getLifetime());
            for (String key : multiSignature.getKeysgroup()) {
                out.writeBytes(AddressFactory.parsePublicKey(stripPrefix(key)));
            }
        } else {
            throw new IllegalArgumentException("Unsupported asset: " + asset);
        }

        if (transaction.getSignature() != null) {
            out.writeBytes(HEX.parseHex(transaction.getSignature()));
        }
        return out.toByteArray();
    }

    @Override
    public String computeId(byte[] serialized) {
        try {
            return HEX.formatHex(MessageDigest.getInstance("SHA-256").digest(serialized));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private TransactionAsset decodeAsset(TransactionType type, ByteBuffer buffer) {
        return switch (type) {
            case TRANSFER -> {
                long amount = buffer.getLong();
                long expiration = Integer.toUnsignedLong(buffer.getInt());
                byte[] recipient = new byte[AddressFactory.ADDRESS_LENGTH];
                buffer.get(recipient);
                yield new TransferAsset(amount, expiration, addressFactory.encode(recipient));
            }
            case SECOND_SIGNATURE -> new SecondSignatureAsset(readHex(buffer, AddressFactory.PUBLIC_KEY_LENGTH));
            case DELEGATE_REGISTRATION -> {
                String username = readShortString(buffer);
                if (username == null) {
                    throw new TransactionDecodeException("Delegate registration without username");
                }
                yield new DelegateAsset(username);
            }
            case VOTE -> {
                int count = Byte.toUnsignedInt(buffer.get());
                List<String> votes = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    int prefix = Byte.toUnsignedInt(buffer.get());
                    if (prefix > 1) {
                        throw new TransactionDecodeException("Invalid vote prefix byte: " + prefix);
                    }
                    char sign = prefix == 1 ? VoteAsset.VOTE_PREFIX : VoteAsset.UNVOTE_PREFIX;
                    votes.add(sign + readHex(buffer, AddressFactory.PUBLIC_KEY_LENGTH));
                }
                yield new VoteAsset(votes);
            }
            case MULTI_SIGNATURE -> {
                int min = Byte.toUnsignedInt(buffer.get());
                int count = Byte.toUnsignedInt(buffer.get());
                int lifetime = Byte.toUnsignedInt(buffer.get());
                List<String> keysgroup = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    keysgroup.add(VoteAsset.VOTE_PREFIX + readHex(buffer, AddressFactory.PUBLIC_KEY_LENGTH));
                }
                yield new MultiSignatureAsset(min, lifetime, keysgroup);
            }
        };
    }

    private static TransactionType decodeType(int code) {
        try {
            return TransactionType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new TransactionDecodeException(e.getMessage(), e);
        }
    }

    private static String readHex(ByteBuffer buffer, int length) {
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return HEX.formatHex(bytes);
    }

    private static String readShortString(ByteBuffer buffer) {
        int length = Byte.toUnsignedInt(buffer.get());
        if (length == 0) {
            return null;
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static void writeShortString(ByteArrayOutputStream out, String value) {
        if (value == null) {
            out.write(0);
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeCount(out, bytes.length);
        out.writeBytes(bytes);
    }

    private static void writeCount(ByteArrayOutputStream out, int count) {
        if (count > 255) {
            throw new IllegalArgumentException("Length does not fit in one byte: " + count);
        }
        out.write(count);
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        out.writeBytes(ByteBuffer.allocate(Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN).putInt(value).array());
    }

    private static void writeLong(ByteArrayOutputStream out, long value) {
        out.writeBytes(ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array());
    }

    private static String stripPrefix(String key) {
        char first = key.charAt(0);
        return first == VoteAsset.VOTE_PREFIX || first == VoteAsset.UNVOTE_PREFIX ? key.substring(1) : key;
    }
}
