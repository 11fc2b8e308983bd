package com.questrail.board.manifest;

import com.questrail.board.api.BoardState;
import com.questrail.board.manifest.codec.BoardManifestDecoder;
import com.questrail.board.manifest.codec.BoardManifestEncoder;
import com.questrail.board.manifest.codec.impl.DefaultBoardManifestDecoder;
import com.questrail.board.manifest.codec.impl.DefaultBoardManifestEncoder;
import com.questrail.board.manifest.codec.impl.ExtensionRecords;
import com.questrail.board.manifest.config.BoardCodecConfig;
import com.questrail.board.manifest.config.EncodeOptions;
import com.questrail.board.manifest.json.ManifestJsonReader;
import com.questrail.board.manifest.json.ManifestJsonWriter;
import com.questrail.board.manifest.model.Manifest;

import java.util.Objects;

/**
 * BoardManifestCodec
 * -----------------------------------------------------------------------------
 * Entry point for collaborators that save and open boards.
 *
 * <p>Bundles the encoder, decoder and JSON binding behind one configuration so
 * that callers exchange only {@link BoardState} values and JSON text:</p>
 *
 * <pre>
 *   save: BoardState -> encode -> Manifest -> JSON
 *   open: JSON -> Manifest -> isBoard? -> decode -> BoardState
 * </pre>
 *
 * <p>Instances are immutable and hold no per-call state, so one codec can be
 * shared freely; every call works on its own identifier index.</p>
 */
public final class BoardManifestCodec
{
    private final BoardManifestEncoder encoder;
    private final BoardManifestDecoder decoder;
    private final ManifestJsonWriter writer;
    private final ManifestJsonReader reader;

    public BoardManifestCodec()
    {
        this(BoardCodecConfig.defaults());
    }

    public BoardManifestCodec(BoardCodecConfig config)
    {
        this(new DefaultBoardManifestEncoder(config),
             new DefaultBoardManifestDecoder(config),
             new ManifestJsonWriter(),
             new ManifestJsonReader());
    }

    public BoardManifestCodec(BoardManifestEncoder encoder,
                              BoardManifestDecoder decoder,
                              ManifestJsonWriter writer,
                              ManifestJsonReader reader)
    {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public Manifest encode(BoardState state, String documentId, String title)
    {
        return encoder.encode(state, documentId, title);
    }

    public Manifest encode(BoardState state, String documentId, String title, EncodeOptions options)
    {
        return encoder.encode(state, documentId, title, options);
    }

    public BoardState decode(Manifest manifest)
    {
        return decoder.decode(manifest);
    }

    /**
     * @return {@code true} if the manifest should be offered as an editable board
     */
    public boolean isBoard(Manifest manifest)
    {
        return ExtensionRecords.isBoard(Objects.requireNonNull(manifest, "manifest"));
    }

    /**
     * Encodes a board and serializes the manifest.
     */
    public String toJson(BoardState state, String documentId, String title)
    {
        return writer.write(encode(state, documentId, title));
    }

    public String toJson(BoardState state, String documentId, String title, EncodeOptions options)
    {
        return writer.write(encode(state, documentId, title, options));
    }

    /**
     * Parses manifest JSON and decodes it, whether or not it carries the board
     * marker. Use {@link #readManifest(String)} and {@link #isBoard(Manifest)}
     * first when only boards should be opened.
     *
     * @throws com.questrail.board.manifest.json.ManifestReadException if the
     *         text is not a JSON object
     */
    public BoardState fromJson(String json)
    {
        return decode(readManifest(json));
    }

    public Manifest readManifest(String json)
    {
        return reader.read(json);
    }

    public String writeManifest(Manifest manifest)
    {
        return writer.write(manifest);
    }
}
