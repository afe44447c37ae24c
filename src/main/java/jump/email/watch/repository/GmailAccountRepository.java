package jump.email.watch.repository;

import jump.email.watch.entity.GmailAccount;
import jump.email.watch.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GmailAccountRepository extends JpaRepository<GmailAccount, String> {
    List<GmailAccount> findByUser(User user);
    List<GmailAccount> findByUserId(String userId);
    Optional<GmailAccount> findByUserAndEmailAddress(User user, String emailAddress);
    Optional<GmailAccount> findByUserIdAndPrimaryAccountTrue(String userId);
}
