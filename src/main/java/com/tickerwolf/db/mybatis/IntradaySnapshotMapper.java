package com.tickerwolf.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDate;

public interface IntradaySnapshotMapper {
    @Select("SELECT cache_key, symbol, trading_date, payload, fetched_at FROM intraday_snapshots WHERE cache_key=#{cacheKey}")
    IntradaySnapshotRow selectByKey(@Param("cacheKey") String cacheKey);

    @Update("UPDATE intraday_snapshots SET symbol=#{symbol}, trading_date=#{tradingDate}, payload=#{payload}, " +
            "fetched_at=#{fetchedAt} WHERE cache_key=#{cacheKey}")
    int update(IntradaySnapshotRow row);

    @Insert("INSERT INTO intraday_snapshots(cache_key, symbol, trading_date, payload, fetched_at) " +
            "VALUES(#{cacheKey}, #{symbol}, #{tradingDate}, #{payload}, #{fetchedAt})")
    int insert(IntradaySnapshotRow row);

    @Delete("DELETE FROM intraday_snapshots WHERE cache_key LIKE #{prefix} AND trading_date < #{cutoff}")
    int deleteOlderThan(@Param("prefix") String keyPrefixPattern, @Param("cutoff") LocalDate cutoff);
}
