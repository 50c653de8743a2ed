package com.questrail.flameconnect.exchange;

import com.questrail.flameconnect.codec.CodecResult;
import com.questrail.flameconnect.codec.ParameterDecoder;
import com.questrail.flameconnect.codec.ParameterEncoder;
import com.questrail.flameconnect.codec.ProtocolError;
import com.questrail.flameconnect.codec.ProtocolException;
import com.questrail.flameconnect.codec.impl.DefaultParameterDecoder;
import com.questrail.flameconnect.codec.impl.DefaultParameterEncoder;
import com.questrail.flameconnect.config.ExchangeConfig;
import com.questrail.flameconnect.model.Parameter;
import com.questrail.flameconnect.observability.ParameterDecodedEvent;
import com.questrail.flameconnect.observability.ParameterErrorEvent;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * ParameterExchange
 * =============================================================================
 * Bridges the cloud relay's base64 parameter entries and the codec.
 *
 * <h2>Architectural Role</h2>
 * <pre>
 *   inbound:   WireParameter  ->  base64 decode  ->  ParameterDecoder  ->  Parameter
 *   outbound:  Parameter      ->  ParameterEncoder  ->  base64 encode  ->  WireParameter
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>Inbound: a failing entry is reported to the observability sink and
 *       dropped; the rest of the batch proceeds. With
 *       {@link ExchangeConfig#skipUndecodable()} off, the first failure aborts
 *       the batch instead.</li>
 *   <li>Outbound: any failure (notably a read-only kind) is reported and
 *       aborts the whole write with {@link ProtocolException}. A partial write
 *       request is never produced.</li>
 * </ul>
 *
 * <p>This class holds no mutable state and is safe for concurrent use as
 * long as the configured sink is.</p>
 */
public final class ParameterExchange
{
    private final ParameterDecoder decoder;
    private final ParameterEncoder encoder;
    private final ExchangeConfig config;

    public ParameterExchange(ExchangeConfig config)
    {
        this(new DefaultParameterDecoder(), new DefaultParameterEncoder(), config);
    }

    public ParameterExchange(ParameterDecoder decoder, ParameterEncoder encoder, ExchangeConfig config)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Decodes a batch of inbound entries, in order.
     *
     * <p>An entry whose value is not valid base64 fails the same way as one
     * the codec rejects, with {@link ProtocolError.MalformedValue}.</p>
     *
     * @return the successfully decoded parameters
     * @throws ProtocolException if skipping is disabled and an entry fails
     */
    public List<Parameter> decodeAll(List<WireParameter> entries)
    {
        Objects.requireNonNull(entries, "entries");

        final List<Parameter> decoded = new ArrayList<>(entries.size());
        for (WireParameter entry : entries) {
            final byte[] frame;
            try {
                frame = Base64.getDecoder().decode(entry.value());
            }
            catch (IllegalArgumentException e) {
                decodeFailed(entry, new ProtocolError.MalformedValue(entry.parameterId(), String.valueOf(e.getMessage())), e);
                continue;
            }

            final CodecResult<Parameter> result = decoder.decode(entry.parameterId(), frame);
            if (result.isSuccess()) {
                final Parameter parameter = result.orElseThrow();
                config.observabilitySink().onParameterDecoded(
                        new ParameterDecodedEvent(config.wallClock().now(), parameter));
                decoded.add(parameter);
                continue;
            }
            decodeFailed(entry, result.error().orElseThrow(), null);
        }
        return decoded;
    }

    private void decodeFailed(WireParameter entry, ProtocolError error, Throwable cause)
    {
        final boolean skip = config.skipUndecodable();
        config.observabilitySink().onDecodeFailure(new ParameterErrorEvent(
                config.wallClock().now(),
                entry.parameterId(),
                error.message(),
                error,
                cause,
                skip));
        if (!skip) {
            throw cause == null ? new ProtocolException(error) : new ProtocolException(error, cause);
        }
    }

    /**
     * Encodes one parameter into an outbound entry.
     *
     * @throws ProtocolException if the parameter cannot be encoded
     */
    public WireParameter encode(Parameter parameter)
    {
        Objects.requireNonNull(parameter, "parameter");

        final CodecResult<byte[]> result = encoder.encode(parameter);
        if (result.isFailure()) {
            final ProtocolError error = result.error().orElseThrow();
            config.observabilitySink().onEncodeFailure(new ParameterErrorEvent(
                    config.wallClock().now(),
                    parameter.kind().id(),
                    error.message(),
                    error,
                    null,
                    false));
            throw new ProtocolException(error);
        }
        return new WireParameter(
                parameter.kind().id(),
                Base64.getEncoder().encodeToString(result.orElseThrow()));
    }

    /**
     * Encodes every parameter, in order. Fails as a whole on the first error.
     */
    public List<WireParameter> encodeAll(List<? extends Parameter> parameters)
    {
        Objects.requireNonNull(parameters, "parameters");

        final List<WireParameter> entries = new ArrayList<>(parameters.size());
        for (Parameter parameter : parameters) {
            entries.add(encode(parameter));
        }
        return entries;
    }

    /**
     * Assembles the write request body for one fireplace.
     */
    public WriteRequest writeRequest(String fireId, List<? extends Parameter> parameters)
    {
        Objects.requireNonNull(fireId, "fireId");
        return new WriteRequest(fireId, encodeAll(parameters));
    }
}
