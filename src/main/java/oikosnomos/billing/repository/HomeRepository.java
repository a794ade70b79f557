package oikosnomos.billing.repository;

import oikosnomos.billing.entity.Home;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HomeRepository extends JpaRepository<Home, String> {

    @Query("SELECT h.id FROM Home h ORDER BY h.id")
    List<String> findAllIds();
}
