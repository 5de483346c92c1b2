package tech.yump.passkeeper.secrets.card;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import tech.yump.passkeeper.storage.AbstractJdbcSecretStorage;

import java.util.List;

@Repository
public class JdbcCardStorage extends AbstractJdbcSecretStorage<StoredCard, CardItem> implements CardStorage {

    public JdbcCardStorage(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate,
                "sec_cards",
                List.of("name", "number", "mask", "month", "year", "cvc", "pin"),
                List.of("name", "number", "mask", "month", "year", "cvc", "pin"),
                List.of("name", "mask"),
                List.of("name", "mask"),
                List.of("name"));
    }

    @Override
    protected Object[] insertValues(StoredCard record) {
        return new Object[]{
                record.name(), record.number(), record.mask(),
                record.month(), record.year(), record.cvc(), record.pin()};
    }

    @Override
    protected RowMapper<StoredCard> recordMapper() {
        return (rs, rowNum) -> new StoredCard(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("number"),
                rs.getString("mask"),
                rs.getInt("month"),
                rs.getInt("year"),
                rs.getString("cvc"),
                rs.getString("pin"));
    }

    @Override
    protected RowMapper<CardItem> itemMapper() {
        return (rs, rowNum) -> new CardItem(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("mask"));
    }
}
