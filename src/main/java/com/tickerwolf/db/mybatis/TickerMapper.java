package com.tickerwolf.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface TickerMapper {
    @Select("<script>SELECT id, ticker FROM tickers WHERE active = TRUE ORDER BY id" +
            "<if test='limit &gt; 0'> LIMIT #{limit}</if></script>")
    List<TickerRow> selectActive(@Param("limit") int limit);

    @Select("SELECT id, ticker FROM tickers WHERE UPPER(ticker) = UPPER(#{symbol}) ORDER BY id LIMIT 1")
    TickerRow selectBySymbol(@Param("symbol") String symbol);
}
