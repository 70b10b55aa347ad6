package chessbot.engine.search;

import java.time.Duration;

public final class SearchConfig {

    // Verifies after each search that the game was restored and the move is legal
    public final boolean debug;

    // Captures first (MVV-LVA) below the root; root moves always keep generation order
    public final boolean useMoveOrdering;

    // Safety nets
    public final long maxHardCapNs;
    public final int maxDepth;

    private SearchConfig(Builder b) {
        debug = b.debug;
        useMoveOrdering = b.useMoveOrdering;
        maxHardCapNs = b.maxHardCapNs;
        maxDepth = b.maxDepth;
    }

    public static class Builder {
        private boolean debug = false;
        private boolean useMoveOrdering = true;
        private long maxHardCapNs = Duration.ofSeconds(120).toNanos();
        private int maxDepth = SearchConstants.MAX_PLY - 1;

        public Builder debug(boolean v){debug=v;return this;}
        public Builder useMoveOrdering(boolean v){useMoveOrdering=v;return this;}
        public Builder maxHardCapNs(long v){maxHardCapNs=v;return this;}
        public Builder maxDepth(int v){
            if(v < 1 || v >= SearchConstants.MAX_PLY) {
                throw new IllegalArgumentException("maxDepth must be in [1, " + (SearchConstants.MAX_PLY - 1) + "], got " + v);
            }
            maxDepth=v;return this;
        }
        public SearchConfig build(){return new SearchConfig(this);}
    }
}
