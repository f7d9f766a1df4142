package com.tradebot.client.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tradebot.core.model.ActiveSessionRoi;
import com.tradebot.core.model.AutoTradingStatus;
import com.tradebot.core.model.MarketAnalysis;
import com.tradebot.core.model.ServerInfo;
import com.tradebot.core.model.TotalBalance;
import com.tradebot.core.model.Trade;
import com.tradebot.core.model.TradingSession;

import java.util.List;

/**
 * Every operation the trading service exposes, with its result type.
 */
public final class RemoteMethods {

    private RemoteMethods() {}

    // Queries
    public static final RemoteMethod<List<TradingSession>> GET_ALL_SESSIONS =
        RemoteMethod.of("getAllSessions", new TypeReference<List<TradingSession>>() {});
    public static final RemoteMethod<TradingSession> GET_SESSION_STATUS =
        RemoteMethod.of("getSessionStatus", TradingSession.class);
    public static final RemoteMethod<List<Trade>> GET_SESSION_TRADES =
        RemoteMethod.of("getSessionTrades", new TypeReference<List<Trade>>() {});
    public static final RemoteMethod<List<MarketAnalysis>> GET_MARKET_ANALYSIS =
        RemoteMethod.of("getMarketAnalysis", new TypeReference<List<MarketAnalysis>>() {});
    public static final RemoteMethod<List<List<MarketAnalysis>>> GET_MARKET_ANALYSIS_BATCH =
        new RemoteMethod<>("getMarketAnalysisBatch", new MarketAnalysisBatchDecoder());
    public static final RemoteMethod<TotalBalance> GET_TOTAL_BALANCE =
        RemoteMethod.of("getTotalBalance", TotalBalance.class);
    public static final RemoteMethod<List<String>> GET_AVAILABLE_SYMBOLS =
        RemoteMethod.of("getAvailableSymbols", new TypeReference<List<String>>() {});
    public static final RemoteMethod<List<String>> GET_ACTIVE_SYMBOLS =
        RemoteMethod.of("getActiveSymbols", new TypeReference<List<String>>() {});
    public static final RemoteMethod<List<ActiveSessionRoi>> GET_ACTIVE_SESSIONS_WITH_ROI =
        RemoteMethod.of("getActiveSessionsWithROI", new TypeReference<List<ActiveSessionRoi>>() {});
    public static final RemoteMethod<Integer> GET_ACTIVE_POSITIONS_COUNT =
        new RemoteMethod<>("getActivePositionsCount", (mapper, data) -> data.path("count").asInt(0));
    public static final RemoteMethod<ServerInfo> GET_SERVER_INFO =
        RemoteMethod.of("getServerInfo", ServerInfo.class);
    public static final RemoteMethod<AutoTradingStatus> GET_AUTO_TRADING_STATUS =
        RemoteMethod.of("getAutoTradingStatus", AutoTradingStatus.class);

    // Commands
    public static final RemoteMethod<TradingSession> INITIALIZE_SESSION =
        RemoteMethod.of("initializeSession", TradingSession.class);
    public static final RemoteMethod<Void> CLOSE_SESSION = RemoteMethod.noResult("closeSession");
    public static final RemoteMethod<Void> ANALYZE_AND_TRADE = RemoteMethod.noResult("analyzeAndTrade");
    public static final RemoteMethod<Void> UPDATE_VOLATILITY_CHECK = RemoteMethod.noResult("updateVolatilityCheck");
    public static final RemoteMethod<Void> START_AUTO_TRADING = RemoteMethod.noResult("startAutoTrading");
    public static final RemoteMethod<Void> STOP_AUTO_TRADING = RemoteMethod.noResult("stopAutoTrading");
    public static final RemoteMethod<Void> UPDATE_AUTO_TRADING_INTERVAL = RemoteMethod.noResult("updateAutoTradingInterval");
}
