package com.ietfdata.client.query;

import com.ietfdata.model.DatatrackerEntity;
import com.ietfdata.model.DocState;
import com.ietfdata.model.DocStateType;
import com.ietfdata.model.Document;
import com.ietfdata.model.Email;
import com.ietfdata.model.Group;
import com.ietfdata.model.GroupState;
import com.ietfdata.model.GroupType;
import com.ietfdata.model.HistoricalEmail;
import com.ietfdata.model.HistoricalPerson;
import com.ietfdata.model.Person;
import com.ietfdata.model.PersonAlias;
import com.ietfdata.model.Submission;
import com.ietfdata.model.uri.ResourceKind;

import java.util.List;

/**
 * A {@link ResourceKind} paired with the entity class its documents decode into.
 *
 * @param <E> entity type of the collection
 */
public final class ResourceType<E extends DatatrackerEntity<?>> {

    public static final ResourceType<Person> PERSON =
            new ResourceType<>(ResourceKind.PERSON, Person.class);
    public static final ResourceType<HistoricalPerson> HISTORICAL_PERSON =
            new ResourceType<>(ResourceKind.HISTORICAL_PERSON, HistoricalPerson.class);
    public static final ResourceType<PersonAlias> PERSON_ALIAS =
            new ResourceType<>(ResourceKind.PERSON_ALIAS, PersonAlias.class);
    public static final ResourceType<Email> EMAIL =
            new ResourceType<>(ResourceKind.EMAIL, Email.class);
    public static final ResourceType<HistoricalEmail> HISTORICAL_EMAIL =
            new ResourceType<>(ResourceKind.HISTORICAL_EMAIL, HistoricalEmail.class);
    public static final ResourceType<Group> GROUP =
            new ResourceType<>(ResourceKind.GROUP, Group.class);
    public static final ResourceType<GroupType> GROUP_TYPE =
            new ResourceType<>(ResourceKind.GROUP_TYPE, GroupType.class);
    public static final ResourceType<GroupState> GROUP_STATE =
            new ResourceType<>(ResourceKind.GROUP_STATE, GroupState.class);
    public static final ResourceType<Document> DOCUMENT =
            new ResourceType<>(ResourceKind.DOCUMENT, Document.class);
    public static final ResourceType<DocState> DOC_STATE =
            new ResourceType<>(ResourceKind.DOC_STATE, DocState.class);
    public static final ResourceType<DocStateType> DOC_STATE_TYPE =
            new ResourceType<>(ResourceKind.DOC_STATE_TYPE, DocStateType.class);
    public static final ResourceType<Submission> SUBMISSION =
            new ResourceType<>(ResourceKind.SUBMISSION, Submission.class);

    private static final List<ResourceType<?>> VALUES = List.of(
            PERSON, HISTORICAL_PERSON, PERSON_ALIAS, EMAIL, HISTORICAL_EMAIL,
            GROUP, GROUP_TYPE, GROUP_STATE,
            DOCUMENT, DOC_STATE, DOC_STATE_TYPE, SUBMISSION);

    private final ResourceKind kind;
    private final Class<E> entityType;

    private ResourceType(ResourceKind kind, Class<E> entityType) {
        this.kind = kind;
        this.entityType = entityType;
    }

    /** All resource types, in {@link ResourceKind} declaration order. */
    public static List<ResourceType<?>> values() {
        return VALUES;
    }

    /** Looks up the resource type of a kind. */
    public static ResourceType<?> of(ResourceKind kind) {
        return VALUES.get(kind.ordinal());
    }

    public ResourceKind kind() {
        return kind;
    }

    public Class<E> entityType() {
        return entityType;
    }

    public String collectionPath() {
        return kind.collectionPath();
    }

    @Override
    public String toString() {
        return kind.name();
    }
}
