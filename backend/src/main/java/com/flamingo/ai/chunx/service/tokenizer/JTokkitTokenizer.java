package com.flamingo.ai.chunx.service.tokenizer;

import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.IntArrayList;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link Tokenizer} backed by a JTokkit byte-level BPE {@link Encoding}.
 *
 * <p>JTokkit reports token ids only, so byte spans are rebuilt from the length of each decoded
 * token. A byte-level token can end inside a multi-byte UTF-8 character; the whole character then
 * belongs to the token it starts in, and later tokens holding only the rest of its bytes get a
 * zero-width span. Spans are therefore disjoint, cover the text and slice to valid UTF-8.
 */
@Slf4j
public class JTokkitTokenizer implements Tokenizer {

  private final Encoding encoding;

  public JTokkitTokenizer(Encoding encoding) {
    this.encoding = encoding;
  }

  @Override
  public List<TokenSpan> encode(String text) {
    IntArrayList tokens = encoding.encodeOrdinary(text);
    byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
    List<TokenSpan> spans = new ArrayList<>(tokens.size());
    int cursor = 0;
    int previousEnd = 0;
    for (int i = 0; i < tokens.size(); i++) {
      IntArrayList single = new IntArrayList(1);
      single.add(tokens.get(i));
      int length = encoding.decodeBytes(single).length;
      int start = Math.max(alignUp(utf8, Math.min(cursor, utf8.length)), previousEnd);
      int end = Math.max(alignUp(utf8, Math.min(cursor + length, utf8.length)), start);
      spans.add(new TokenSpan(start, end));
      previousEnd = end;
      cursor += length;
    }
    if (cursor != utf8.length) {
      log.warn(
          "Decoded token bytes ({}) do not cover the input ({} bytes)", cursor, utf8.length);
    }
    return spans;
  }

  @Override
  public int countTokens(String text) {
    return encoding.countTokensOrdinary(text);
  }

  private static int alignUp(byte[] utf8, int offset) {
    while (offset < utf8.length && isContinuation(utf8[offset])) {
      offset++;
    }
    return offset;
  }

  private static boolean isContinuation(byte b) {
    return (b & 0xC0) == 0x80;
  }
}
