package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.config.ImporterProperties;
import com.mobilebackup.importer.model.ContactRecord;
import com.mobilebackup.importer.model.LabeledValue;
import com.mobilebackup.importer.support.BackupFixture;
import com.mobilebackup.importer.support.SampleData;
import com.mobilebackup.importer.sync.CancellationToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ContactsExtractorTest {

    @TempDir
    Path root;

    private final ContactsExtractor extractor = new ContactsExtractor();

    @Test
    void extractsPeopleWithLabeledValues() {
        BackupFixture fixture = BackupFixture.create(root);
        SampleData.fillContacts(fixture.addressBookDatabase());

        List<ContactRecord> contacts;
        try (BackupContainer container = new BackupContainerReader(new ImporterProperties()).open(root);
             Extraction<ContactRecord> extraction = extractor.extract(container, CancellationToken.none())) {
            contacts = extraction.getRecords().collect(Collectors.toList());
        }

        assertThat(contacts).extracting(ContactRecord::getId).containsExactly("1", "2");

        ContactRecord john = contacts.get(0);
        assertEquals("John Appleseed", john.displayName());
        assertEquals("met at conf", john.getNotes());
        assertThat(john.getPhones()).containsExactly(
                new LabeledValue("mobile", "+1 (941) 518-0701"),
                new LabeledValue("other", "555-0000"));
        assertThat(john.getEmails()).containsExactly(
                new LabeledValue("work", "john@work.com"),
                new LabeledValue("other", "j@home.com"));

        assertEquals("Acme Corp", contacts.get(1).displayName());
        assertThat(contacts.get(1).getPhones()).containsExactly(new LabeledValue("work", "4155550123"));
    }

    @Test
    void singleFileImportBypassesIndex() {
        Path addressBook = root.resolve("AddressBook.sqlitedb");
        BackupFixture.createAddressBook(addressBook);
        SampleData.fillContacts(addressBook);

        try (Extraction<ContactRecord> extraction =
                     extractor.extractFromDatabase(addressBook, CancellationToken.none())) {
            assertEquals(2, extraction.getRecords().count());
        }
    }
}
