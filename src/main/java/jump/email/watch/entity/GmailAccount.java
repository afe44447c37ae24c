package jump.email.watch.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * A Gmail mailbox connected by a principal, together with the credential used to watch it.
 */
@Entity
@Table(name = "gmail_accounts")
@Getter
@Setter
@ToString(exclude = {"user", "token"})
@EqualsAndHashCode(exclude = "user")
public class GmailAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private User user;

    private String emailAddress;

    private boolean primaryAccount;

    @Embedded
    private OAuthToken token;

    @Enumerated(EnumType.STRING)
    private CredentialStatus credentialStatus;
}
