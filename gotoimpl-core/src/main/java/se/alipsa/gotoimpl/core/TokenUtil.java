package se.alipsa.gotoimpl.core;

import se.alipsa.gotoimpl.core.model.Position;

/** Tiny helpers for position/offset math that don't depend on any language-specific lexer. */
public final class TokenUtil {
  private TokenUtil() {}

  public static int positionToOffset(String text, int line, int column) {
    int curLine = 0, idx = 0, n = text.length();
    while (curLine < line && idx < n) {
      int nl = text.indexOf('\n', idx);
      if (nl < 0) return n;
      idx = nl + 1;
      curLine++;
    }
    return Math.min(idx + Math.max(column, 0), n);
  }

  public static Position offsetToPosition(String text, int offset) {
    int end = Math.max(0, Math.min(offset, text.length()));
    int line = 0, col = 0;
    for (int i = 0; i < end; i++) {
      if (text.charAt(i) == '\n') { line++; col = 0; } else { col++; }
    }
    return new Position(line, col);
  }

  public static CharSequence preview(String text) {
    int n = Math.min(text == null ? 0 : text.length(), 1024);
    return text == null ? "" : text.subSequence(0, n);
  }
}
