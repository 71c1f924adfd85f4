package com.libragraph.backup.core.store;

import com.libragraph.backup.archivers.store.RecipientStore;
import com.libragraph.backup.core.dao.RecipientDao;
import jakarta.enterprise.context.ApplicationScoped;
import org.jdbi.v3.core.Handle;

import java.util.List;

@ApplicationScoped
public class JdbiRecipientStore implements RecipientStore {

    @Override
    public List<String> findAllAddresses(Handle tx) {
        return tx.attach(RecipientDao.class).findAllAddresses();
    }
}
