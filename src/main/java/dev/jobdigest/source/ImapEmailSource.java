package dev.jobdigest.source;

import dev.jobdigest.config.InboxProperties;
import dev.jobdigest.model.EmailMessage;
import jakarta.mail.Address;
import jakarta.mail.BodyPart;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.FlagTerm;
import jakarta.mail.search.MessageIDTerm;
import jakarta.mail.search.ReceivedDateTerm;
import jakarta.mail.search.SearchTerm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Clock;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Reads job alerts from an IMAP mailbox. Messages are identified by their Message-ID header,
 * or by UIDVALIDITY and UID when they carry none.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.inbox.provider", havingValue = "imap")
public class ImapEmailSource implements EmailSource {

    private final InboxProperties properties;
    private final Clock clock;

    @Override
    public String getName() {
        return "IMAP";
    }

    @Override
    public Mono<List<EmailMessage>> listRecent() {
        return Mono.fromCallable(this::fetchUnread)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> markRead(String messageId) {
        return Mono.<Void>fromRunnable(() -> withMessage(messageId, (folder, message) -> {
                    message.setFlag(Flags.Flag.SEEN, true);
                    return false;
                }))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> markReadAndArchive(String messageId) {
        return Mono.<Void>fromRunnable(() -> withMessage(messageId, (folder, message) -> {
                    message.setFlag(Flags.Flag.SEEN, true);
                    Folder archive = folder.getStore().getFolder(properties.getArchiveFolder());
                    if (!archive.exists() && !archive.create(Folder.HOLDS_MESSAGES)) {
                        throw new InboxException("Cannot create archive folder " + properties.getArchiveFolder());
                    }
                    folder.copyMessages(new Message[]{message}, archive);
                    message.setFlag(Flags.Flag.DELETED, true);
                    return true;
                }))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private List<EmailMessage> fetchUnread() {
        Store store = connect();
        try {
            Folder folder = store.getFolder(properties.getFolder());
            folder.open(Folder.READ_ONLY);
            try {
                Date since = Date.from(clock.instant().minus(properties.getLookback()));
                SearchTerm unreadRecent = new AndTerm(
                        new FlagTerm(new Flags(Flags.Flag.SEEN), false),
                        new ReceivedDateTerm(ComparisonTerm.GE, since));
                Message[] found = folder.search(unreadRecent);

                List<Message> newestLast = Arrays.stream(found)
                        .sorted(Comparator.comparing(this::receivedDate))
                        .toList();
                int skip = Math.max(0, newestLast.size() - properties.getMaxMessages());

                List<EmailMessage> emails = newestLast.stream()
                        .skip(skip)
                        .map(message -> toEmailMessage(folder, message))
                        .flatMap(Optional::stream)
                        .toList();
                log.info("Found {} unread messages in {} since {}", emails.size(), properties.getFolder(), since);
                return emails;
            } finally {
                folder.close(false);
            }
        } catch (MessagingException e) {
            throw new InboxException("Failed to list messages: " + e.getMessage(), e);
        } finally {
            closeQuietly(store);
        }
    }

    /**
     * Open the folder read-write, apply the action to the message and close, expunging when asked.
     */
    private void withMessage(String messageId, MessageAction action) {
        Store store = connect();
        try {
            Folder folder = store.getFolder(properties.getFolder());
            folder.open(Folder.READ_WRITE);
            boolean expunge = false;
            try {
                expunge = action.apply(folder, findMessage(folder, messageId));
            } finally {
                folder.close(expunge);
            }
        } catch (MessagingException e) {
            throw new InboxException("Failed to update message " + messageId + ": " + e.getMessage(), e);
        } finally {
            closeQuietly(store);
        }
    }

    private Store connect() {
        Properties mailProperties = new Properties();
        mailProperties.put("mail.store.protocol", "imaps");
        mailProperties.put("mail.imaps.host", properties.getHost());
        mailProperties.put("mail.imaps.port", String.valueOf(properties.getPort()));
        mailProperties.put("mail.imaps.connectiontimeout", "30000");
        mailProperties.put("mail.imaps.timeout", "60000");
        try {
            Store store = Session.getInstance(mailProperties).getStore("imaps");
            store.connect(properties.getHost(), properties.getPort(), properties.getUsername(), properties.getPassword());
            return store;
        } catch (MessagingException e) {
            throw new InboxException("Cannot connect to " + properties.getHost() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Read one message. A message whose body cannot be decoded is passed on without a body,
     * so it is still recorded once downstream; one that cannot even be keyed is skipped.
     */
    static Optional<EmailMessage> toEmailMessage(Folder folder, Message message) {
        String id;
        try {
            id = messageKey(folder, message);
        } catch (MessagingException | InboxException e) {
            log.warn("Skipping message {}: {}", message.getMessageNumber(), e.getMessage());
            return Optional.empty();
        }

        String subject = "";
        String from = "";
        try {
            subject = message.getSubject();
            from = sender(message);
            return Optional.of(new EmailMessage(id, subject, from, extractText(message)));
        } catch (MessagingException | IOException e) {
            log.warn("Message {} ('{}') has an unreadable body: {}", id, subject, e.getMessage());
            return Optional.of(new EmailMessage(id, subject, from, ""));
        }
    }

    /**
     * Stable key of a message: its Message-ID, else "uid:&lt;uidvalidity&gt;:&lt;uid&gt;".
     * Message numbers are not used since they shift on every expunge.
     */
    static String messageKey(Folder folder, Message message) throws MessagingException {
        if (message instanceof MimeMessage mime && mime.getMessageID() != null && !mime.getMessageID().isBlank()) {
            return mime.getMessageID();
        }
        if (folder instanceof UIDFolder uidFolder) {
            return new UidKey(uidFolder.getUIDValidity(), uidFolder.getUID(message)).format();
        }
        throw new InboxException("Message " + message.getMessageNumber() + " has no Message-ID and the folder no UIDs");
    }

    /**
     * Resolve a key produced by {@link #messageKey} back to the message.
     */
    static Message findMessage(Folder folder, String messageId) throws MessagingException {
        Optional<UidKey> uidKey = UidKey.parse(messageId);
        if (uidKey.isPresent()) {
            if (!(folder instanceof UIDFolder uidFolder)) {
                throw new InboxException("Folder " + folder.getFullName() + " does not support UIDs");
            }
            UidKey key = uidKey.get();
            if (uidFolder.getUIDValidity() != key.uidValidity()) {
                throw new InboxException("UIDVALIDITY of " + folder.getFullName() + " changed, cannot resolve "
                        + messageId);
            }
            Message message = uidFolder.getMessageByUID(key.uid());
            if (message == null) {
                throw new InboxException("Message not found: " + messageId);
            }
            return message;
        }

        Message[] matches = folder.search(new MessageIDTerm(messageId));
        if (matches.length == 0) {
            throw new InboxException("Message not found: " + messageId);
        }
        return matches[0];
    }

    /**
     * Plain text of a part, preferring text/plain alternatives and stripping HTML otherwise.
     */
    static String extractText(Part part) throws MessagingException, IOException {
        if (part.isMimeType("text/plain")) {
            return String.valueOf(part.getContent());
        }
        if (part.isMimeType("text/html")) {
            return Jsoup.parse(String.valueOf(part.getContent())).text();
        }
        if (part.isMimeType("multipart/alternative")) {
            Multipart multipart = (Multipart) part.getContent();
            String html = null;
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                if (bodyPart.isMimeType("text/plain")) {
                    return String.valueOf(bodyPart.getContent());
                }
                if (html == null && bodyPart.isMimeType("text/html")) {
                    html = extractText(bodyPart);
                }
            }
            return html != null ? html : "";
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                if (Part.ATTACHMENT.equalsIgnoreCase(bodyPart.getDisposition())) {
                    continue;
                }
                String partText = extractText(bodyPart);
                if (!partText.isBlank()) {
                    text.append(partText).append('\n');
                }
            }
            return text.toString().trim();
        }
        return "";
    }

    private static String sender(Message message) throws MessagingException {
        Address[] from = message.getFrom();
        return from != null && from.length > 0 ? from[0].toString() : "";
    }

    private Date receivedDate(Message message) {
        try {
            Date received = message.getReceivedDate();
            return received != null ? received : new Date(0);
        } catch (MessagingException e) {
            log.debug("No received date on message {}: {}", message.getMessageNumber(), e.getMessage());
            return new Date(0);
        }
    }

    private void closeQuietly(Store store) {
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("Error closing IMAP store: {}", e.getMessage());
        }
    }

    record UidKey(long uidValidity, long uid) {

        private static final String PREFIX = "uid:";

        String format() {
            return PREFIX + uidValidity + ":" + uid;
        }

        static Optional<UidKey> parse(String key) {
            if (key == null || !key.startsWith(PREFIX)) {
                return Optional.empty();
            }
            String[] parts = key.substring(PREFIX.length()).split(":");
            if (parts.length != 2) {
                return Optional.empty();
            }
            try {
                return Optional.of(new UidKey(Long.parseLong(parts[0]), Long.parseLong(parts[1])));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
    }

    @FunctionalInterface
    private interface MessageAction {
        /**
         * @return true if the folder should be expunged on close
         */
        boolean apply(Folder folder, Message message) throws MessagingException;
    }
}
