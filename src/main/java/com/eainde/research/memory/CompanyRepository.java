package com.eainde.research.memory;

import com.eainde.research.exception.PersistenceException;
import com.eainde.research.model.Company;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class CompanyRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Company> rowMapper;

    public CompanyRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> {
            Timestamp updated = rs.getTimestamp("last_updated");
            return new Company(
                    rs.getString("symbol"),
                    rs.getString("name"),
                    rs.getString("sector"),
                    rs.getString("industry"),
                    rs.getObject("market_cap", Double.class),
                    updated == null ? null : updated.toInstant(),
                    json.readMap(rs.getString("fundamentals")),
                    json.readVector(rs.getString("embedding")));
        };
    }

    public Optional<Company> findBySymbol(String symbol) {
        return jdbcTemplate.query("SELECT * FROM companies WHERE symbol = ?", rowMapper, symbol)
                .stream().findFirst();
    }

    public List<Company> findAllWithEmbedding() {
        return jdbcTemplate.query("SELECT * FROM companies WHERE embedding IS NOT NULL", rowMapper);
    }

    public void save(Company company) {
        Timestamp updated = Timestamp.from(company.lastUpdated() != null ? company.lastUpdated() : Instant.now());
        String fundamentals = json.write(company.fundamentals());
        String embedding = json.writeVector(company.embedding());
        try {
            int rows = jdbcTemplate.update("""
                    UPDATE companies
                    SET name = ?, sector = ?, industry = ?, market_cap = ?, last_updated = ?,
                        fundamentals = ?, embedding = ?
                    WHERE symbol = ?
                    """,
                    company.name(), company.sector(), company.industry(), company.marketCap(), updated,
                    fundamentals, embedding, company.symbol());
            if (rows == 0) {
                jdbcTemplate.update("""
                        INSERT INTO companies
                            (symbol, name, sector, industry, market_cap, last_updated, fundamentals, embedding)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                        company.symbol(), company.name(), company.sector(), company.industry(),
                        company.marketCap(), updated, fundamentals, embedding);
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save company " + company.symbol(), e);
        }
    }
}
