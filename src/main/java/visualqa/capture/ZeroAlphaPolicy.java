package visualqa.capture;

/**
 * What the normalizer does with a pixel whose alpha bits are all zero.
 *
 * <p>Many ARGB visuals leave the alpha byte at 0 for drawables that are in fact
 * opaque, so reading it literally would turn every captured frame transparent.
 * The trade-off is that genuinely transparent-black pixels become opaque black.
 */
public enum ZeroAlphaPolicy {

    /** Zero alpha is read as fully opaque (255). */
    OPAQUE,

    /** Zero alpha is kept as 0. */
    PRESERVE
}
